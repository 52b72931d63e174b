package io.hartransformer.api.plugin;

public class InvalidContractException extends RuntimeException {
   public InvalidContractException(String msg) {
      super(msg);
   }

   public InvalidContractException(String msg, Throwable cause) {
      super(msg, cause);
   }
}

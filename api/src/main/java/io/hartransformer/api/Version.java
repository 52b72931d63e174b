package io.hartransformer.api;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.jar.Attributes;
import java.util.jar.Manifest;

import org.apache.logging.log4j.LogManager;

public class Version {
   public static final String VERSION;
   public static final String COMMIT_ID;

   static {
      String version = "unknown";
      String commitId = "unknown";
      try {
         String classPath = Version.class.getResource(Version.class.getSimpleName() + ".class").toString();
         if (classPath.startsWith("jar")) {
            String manifestPath = classPath.substring(0, classPath.lastIndexOf('!') + 1) + "/META-INF/MANIFEST.MF";
            try (InputStream stream = new URL(manifestPath).openStream()) {
               Attributes attr = new Manifest(stream).getMainAttributes();
               if (attr.getValue("Implementation-Version") != null) {
                  version = attr.getValue("Implementation-Version");
               }
               if (attr.getValue("Scm-Revision") != null) {
                  commitId = attr.getValue("Scm-Revision");
               }
            }
         }
      } catch (IOException | RuntimeException e) {
         LogManager.getLogger(Version.class).error("Cannot find version info.", e);
      } finally {
         VERSION = version;
         COMMIT_ID = commitId;
      }
   }

   private Version() {
   }
}

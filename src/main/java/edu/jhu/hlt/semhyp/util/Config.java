package edu.jhu.hlt.semhyp.util;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

import org.apache.log4j.Logger;

/**
 * String key/value configuration, from files, command line arguments, and the
 * system property -DsemhypProperties="k1=v1,k2=v2".
 */
public class Config {
  public static final Logger LOG = Logger.getLogger(Config.class);
  public static final String SYSTEM_PROPERTY = "semhypProperties";
  public static boolean VERBOSE = false;

  /**
   * Reads key-value pairs, one on each line, separated by a tab. Blank lines
   * and lines starting with '#' are skipped.
   * @param readJavaProperties if true, will add entries from the Java system
   * property {@link #SYSTEM_PROPERTY}, overriding the file.
   */
  public static Map<String, String> readConfig(File f, boolean readJavaProperties) {
    LOG.info("[readConfig] from " + f.getPath());
    if (!f.isFile())
      throw new IllegalArgumentException(f.getPath() + " is not a file");
    Map<String, String> configuration = new HashMap<>();
    try (BufferedReader r = Files.newBufferedReader(f.toPath(), StandardCharsets.UTF_8)) {
      for (String line = r.readLine(); line != null; line = r.readLine()) {
        if (line.trim().isEmpty() || line.startsWith("#"))
          continue;
        String[] tok = line.split("\t", 2);
        if (tok.length != 2)
          throw new IllegalArgumentException("not a tab separated key/value: \"" + line + "\"");
        if (VERBOSE)
          LOG.info("[readConfig] adding " + tok[0] + "=" + tok[1]);
        String old = configuration.put(tok[0], tok[1]);
        if (old != null)
          throw new IllegalArgumentException(tok[0] + " has two values in " + f.getPath());
      }
    } catch (IOException e) {
      throw new RuntimeException(e);
    }
    if (readJavaProperties)
      addJavaPropertiesToConfig(configuration, true);
    return configuration;
  }

  /**
   * Assumes that args is of the form
   * [specialValue] ([key] [value])*
   * and populates the given Map.
   * @param readJavaProperties if true, will add entries from the Java system
   * property {@link #SYSTEM_PROPERTY}.
   * @return the first value (specialValue)
   */
  public static String parseIntoMap(String[] args, Map<String, String> config, boolean readJavaProperties) {
    if (args.length % 2 != 1)
      throw new IllegalArgumentException("expected a name followed by key/value pairs: " + Arrays.toString(args));
    String name = args[0];
    for (int i = 1; i < args.length; i += 2) {
      if (VERBOSE)
        LOG.info("[parseIntoMap] adding " + args[i] + "=" + args[i + 1]);
      String oldValue = config.put(args[i], args[i + 1]);
      if (oldValue != null) {
        throw new RuntimeException(args[i] + " has at least two values: "
            + args[i + 1] + " and " + oldValue);
      }
    }
    if (readJavaProperties)
      addJavaPropertiesToConfig(config, false);
    return name;
  }

  public static boolean getBoolean(Map<String, String> config, String key, boolean defaultValue) {
    String v = config.get(key);
    if (v == null)
      return defaultValue;
    if (!"true".equalsIgnoreCase(v) && !"false".equalsIgnoreCase(v))
      throw new IllegalArgumentException(key + " should be true or false: " + v);
    return Boolean.parseBoolean(v);
  }

  private static void addJavaPropertiesToConfig(Map<String, String> addTo, boolean allowOverwrite) {
    String value = System.getProperty(SYSTEM_PROPERTY);
    if (value == null) return;
    for (String v : value.split(",")) {
      v = v.trim();
      if (v.isEmpty()) continue;
      String[] kv = v.split("=");
      if (kv.length != 2)
        throw new IllegalStateException("kv=" + Arrays.toString(kv));
      if (VERBOSE)
        LOG.info("[addJavaProperties] adding " + kv[0] + "=" + kv[1]);
      String old = addTo.put(kv[0], kv[1]);
      if (!allowOverwrite && old != null) {
        throw new RuntimeException(kv[0] + " has two values: \"" + kv[1]
            + "\" and \"" + old + "\"");
      }
    }
  }
}

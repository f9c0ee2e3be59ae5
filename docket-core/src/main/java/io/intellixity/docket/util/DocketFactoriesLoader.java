package io.intellixity.docket.util;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.*;

/**
 * spring.factories-style loader for docket extensions.
 * <p>
 * Reads every {@code META-INF/docket.factories} resource on the class path. Each resource is a
 * Properties file keyed by extension interface name, values being comma-separated implementation
 * class names:
 * <pre>
 * io.intellixity.docket.validation.expect.ExpectationProvider=com.acme.EmailExpectations
 * </pre>
 * Implementations are instantiated through their public no-arg constructor, in discovery order, once
 * per class name.
 */
public final class DocketFactoriesLoader {
  public static final String RESOURCE = "META-INF/docket.factories";

  private DocketFactoriesLoader() {}

  public static <T> List<T> load(Class<T> spiType) {
    return load(spiType, Thread.currentThread().getContextClassLoader());
  }

  public static <T> List<T> load(Class<T> spiType, ClassLoader cl) {
    Objects.requireNonNull(spiType, "spiType");
    if (cl == null) cl = DocketFactoriesLoader.class.getClassLoader();

    String key = spiType.getName();
    LinkedHashSet<String> implNames = new LinkedHashSet<>();

    Enumeration<URL> resources;
    try {
      resources = cl.getResources(RESOURCE);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to enumerate " + RESOURCE, e);
    }

    while (resources.hasMoreElements()) {
      URL url = resources.nextElement();
      Properties p = new Properties();
      try (InputStream in = url.openStream()) {
        p.load(in);
      } catch (IOException e) {
        throw new IllegalStateException("Failed to load " + RESOURCE + " from " + url, e);
      }

      String v = p.getProperty(key);
      if (v == null || v.isBlank()) continue;
      for (String part : v.split(",")) {
        String name = part.trim();
        if (!name.isEmpty()) implNames.add(name);
      }
    }

    List<T> out = new ArrayList<>(implNames.size());
    for (String implName : implNames) {
      out.add(newInstance(implName, spiType, cl));
    }
    return out;
  }

  private static <T> T newInstance(String implName, Class<T> spiType, ClassLoader cl) {
    try {
      Class<?> raw = Class.forName(implName, true, cl);
      if (!spiType.isAssignableFrom(raw)) {
        throw new IllegalArgumentException("Class " + implName + " does not implement " + spiType.getName());
      }
      return spiType.cast(raw.getDeclaredConstructor().newInstance());
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException("Failed to instantiate " + implName + " for " + spiType.getName(), e);
    }
  }
}

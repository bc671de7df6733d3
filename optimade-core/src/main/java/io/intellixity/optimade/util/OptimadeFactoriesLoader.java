package io.intellixity.optimade.util;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.*;

/**
 * Minimal spring.factories-style loader for named implementations.
 *
 * Looks up every resource with the given name on the classpath. Each resource is a Java Properties
 * file mapping a name to an implementation class:
 *
 * <pre>
 * v1.0.0=io.intellixity.optimade.filter.grammar.OptimadeFilterV1Grammar
 * v1.0.0.develop=com.acme.DevelopGrammar
 * </pre>
 *
 * Implementations need a public no-arg constructor. Whitespace is ignored.
 */
public final class OptimadeFactoriesLoader {
  private OptimadeFactoriesLoader() {}

  public static <T> Map<String, T> loadNamed(String resource, Class<T> spiType) {
    return loadNamed(resource, spiType, Thread.currentThread().getContextClassLoader());
  }

  public static <T> Map<String, T> loadNamed(String resource, Class<T> spiType, ClassLoader cl) {
    Objects.requireNonNull(resource, "resource");
    Objects.requireNonNull(spiType, "spiType");
    if (cl == null) cl = OptimadeFactoriesLoader.class.getClassLoader();

    Enumeration<URL> resources;
    try {
      resources = cl.getResources(resource);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to enumerate " + resource, e);
    }

    // name -> implementation class name, first resource wins on identical entries
    Map<String, String> implNames = new LinkedHashMap<>();
    while (resources.hasMoreElements()) {
      URL url = resources.nextElement();
      Properties p = new Properties();
      try (InputStream in = url.openStream()) {
        p.load(in);
      } catch (IOException e) {
        throw new IllegalStateException("Failed to load " + resource + " from " + url, e);
      }

      for (String name : new TreeSet<>(p.stringPropertyNames())) {
        String impl = p.getProperty(name).trim();
        if (impl.isEmpty()) continue;
        String prev = implNames.putIfAbsent(name.trim(), impl);
        if (prev != null && !prev.equals(impl)) {
          throw new IllegalStateException("Conflicting " + resource + " entries for '" + name + "': " + prev + ", " + impl);
        }
      }
    }

    Map<String, T> out = new LinkedHashMap<>();
    for (var e : implNames.entrySet()) {
      out.put(e.getKey(), newInstance(e.getValue(), spiType, cl));
    }
    return out;
  }

  private static <T> T newInstance(String implName, Class<T> spiType, ClassLoader cl) {
    try {
      Class<?> raw = Class.forName(implName, true, cl);
      if (!spiType.isAssignableFrom(raw)) {
        throw new IllegalArgumentException("Class " + implName + " does not implement " + spiType.getName());
      }
      @SuppressWarnings("unchecked")
      Class<? extends T> impl = (Class<? extends T>) raw;
      return impl.getDeclaredConstructor().newInstance();
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException("Failed to instantiate " + implName + " for " + spiType.getName(), e);
    }
  }
}

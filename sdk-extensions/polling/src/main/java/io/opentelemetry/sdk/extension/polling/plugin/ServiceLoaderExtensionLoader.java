/*
 * Copyright The OpenTelemetry Authors
 * SPDX-License-Identifier: Apache-2.0
 */

package io.opentelemetry.sdk.extension.polling.plugin;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * 基于 {@link ServiceLoader} 的插件加载器
 *
 * <p>单个提供者无法实例化（{@link ServiceConfigurationError}）或创建插件时抛出
 * {@link ExtensionLoadException}，都只会跳过该插件。
 */
public final class ServiceLoaderExtensionLoader implements ExtensionLoader {

  private static final Logger logger =
      Logger.getLogger(ServiceLoaderExtensionLoader.class.getName());

  private final ClassLoader classLoader;

  public ServiceLoaderExtensionLoader() {
    this(ServiceLoaderExtensionLoader.class.getClassLoader());
  }

  public ServiceLoaderExtensionLoader(ClassLoader classLoader) {
    this.classLoader = classLoader;
  }

  @Override
  public List<Pollster> loadPollsters(String namespace) {
    List<Pollster> pollsters = new ArrayList<>();
    for (PollsterProvider provider : loadProviders(PollsterProvider.class)) {
      if (!namespace.equals(provider.getNamespace())) {
        continue;
      }
      Pollster pollster = createSafely(provider, PollsterProvider::create);
      if (pollster != null) {
        pollsters.add(pollster);
      }
    }
    logger.log(
        Level.INFO,
        "Loaded {0} pollsters for namespace {1}",
        new Object[] {pollsters.size(), namespace});
    return Collections.unmodifiableList(pollsters);
  }

  @Override
  public List<Discoverer> loadDiscoverers() {
    List<Discoverer> discoverers = new ArrayList<>();
    for (DiscovererProvider provider : loadProviders(DiscovererProvider.class)) {
      Discoverer discoverer = createSafely(provider, DiscovererProvider::create);
      if (discoverer != null) {
        discoverers.add(discoverer);
      }
    }
    logger.log(Level.INFO, "Loaded {0} discoverers", discoverers.size());
    return Collections.unmodifiableList(discoverers);
  }

  private <P> List<P> loadProviders(Class<P> type) {
    List<P> providers = new ArrayList<>();
    Iterator<P> iterator = ServiceLoader.load(type, classLoader).iterator();
    while (true) {
      try {
        if (!iterator.hasNext()) {
          break;
        }
        providers.add(iterator.next());
      } catch (ServiceConfigurationError e) {
        logger.log(
            Level.SEVERE,
            "Skip loading extension provider for " + type.getSimpleName() + ": " + e.getMessage(),
            e);
      }
    }
    return providers;
  }

  @Nullable
  private static <P, T> T createSafely(P provider, Function<P, T> factory) {
    try {
      return factory.apply(provider);
    } catch (ExtensionLoadException e) {
      logger.log(
          Level.SEVERE,
          "Skip loading extension {0}: {1}",
          new Object[] {provider.getClass().getName(), e.getMessage()});
      return null;
    }
  }
}

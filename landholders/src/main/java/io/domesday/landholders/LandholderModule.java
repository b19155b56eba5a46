package io.domesday.landholders;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;

public class LandholderModule extends AbstractModule {
    private final LoaderConfig config;

    public LandholderModule(LoaderConfig config) { this.config = config; }

    @Override
    protected void configure() {
        bind(LoaderConfig.class).toInstance(config);
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton LandholderStore store(MetricRegistry registry) {
        return new LandholderStore(config.database(), config.coercion(), registry);
    }
}

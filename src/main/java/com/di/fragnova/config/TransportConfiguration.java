package com.di.fragnova.config;

import com.di.fragnova.transport.SimulatedTransport;
import com.di.fragnova.transport.TransportProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * The default {@link com.di.fragnova.transport.Transport}: the latency-modelling simulated engine.
 */
@Configuration
public class TransportConfiguration {

    @Bean(destroyMethod = "close")
    public SimulatedTransport simulatedTransport(TransportProperties transportProperties) {
        return new SimulatedTransport(transportProperties);
    }
}

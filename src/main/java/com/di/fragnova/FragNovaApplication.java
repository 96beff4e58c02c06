package com.di.fragnova;

import com.di.fragnova.descriptor.DescriptorProperties;
import com.di.fragnova.placement.PlannerProperties;
import com.di.fragnova.residency.ResidencyProperties;
import com.di.fragnova.transport.TransportProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties({ PlannerProperties.class, ResidencyProperties.class,
        TransportProperties.class, DescriptorProperties.class })
public class FragNovaApplication {

	public static void main(String[] args) {
		SpringApplication.run(FragNovaApplication.class, args);
	}
}

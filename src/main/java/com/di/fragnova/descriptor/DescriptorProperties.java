package com.di.fragnova.descriptor;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Where to find the descriptor loaded at startup. Any Spring resource location
 * ({@code classpath:}, {@code file:}, plain path). Blank = wait for API calls.
 */
@Data
@ConfigurationProperties(prefix = "fragnova.descriptor")
public class DescriptorProperties {

    private String path;

    /** Whether the startup runner should also seed the residency controller from the plan. */
    private boolean initializeResidency = true;

    public boolean hasPath() {
        return path != null && !path.isBlank();
    }
}

package org.hdrequalize.equalization;

import java.util.concurrent.ExecutorService;

import javax.annotation.Nullable;

import org.apache.commons.lang3.StringUtils;

public enum EqualizationMethod {
    GLOBAL {
        @Override
        public Equalizer createEqualizer(EqualizationParams params, @Nullable ExecutorService executorService) {
            return new GlobalEqualizer(params);
        }
    },
    ADAPTIVE {
        @Override
        public Equalizer createEqualizer(EqualizationParams params, @Nullable ExecutorService executorService) {
            return new AdaptiveEqualizer(params, executorService);
        }
    };

    /**
     * @param executorService executor for the methods that can run in parallel; null runs on the calling thread
     */
    public abstract Equalizer createEqualizer(EqualizationParams params, @Nullable ExecutorService executorService);

    public static EqualizationMethod fromName(String name) {
        for (EqualizationMethod method : values()) {
            if (StringUtils.equalsIgnoreCase(method.name(), StringUtils.trim(name))) {
                return method;
            }
        }
        throw new IllegalArgumentException("Unknown equalization method: " + name);
    }
}

/*
 *  Copyright (C) 2020-2025 Lucas Nishimura <lucas.nishimura@gmail.com>
 *
 *  This program is free software: you can redistribute it and/or modify
 *  it under the terms of the GNU General Public License as published by
 *  the Free Software Foundation, either version 3 of the License, or
 *  (at your option) any later version.
 *
 *  This program is distributed in the hope that it will be useful,
 *  but WITHOUT ANY WARRANTY; without even the implied warranty of
 *  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *  GNU General Public License for more details.
 *
 *  You should have received a copy of the GNU General Public License
 *  along with this program.  If not, see <https://www.gnu.org/licenses/>
 */

package dev.nishisan.fifo.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import dev.nishisan.fifo.queue.BoundedFifo;
import dev.nishisan.fifo.queue.OverflowPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads queue definitions from YAML files and turns them into {@link BoundedFifo.Options}.
 * <p>
 * Placeholders of the form {@code ${VAR}} or {@code ${VAR:default}} are resolved before parsing.
 */
public class FifoConfigLoader {

    private static final Logger logger = LoggerFactory.getLogger(FifoConfigLoader.class);
    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([^}]+)\\}");
    private static final ObjectMapper mapper;

    static {
        YAMLFactory yamlFactory = new YAMLFactory()
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES);
        mapper = new ObjectMapper(yamlFactory);
    }

    private FifoConfigLoader() {
    }

    public static FifoYamlConfig load(Path yamlFile) throws IOException {
        return load(yamlFile, System::getenv);
    }

    public static FifoYamlConfig load(Path yamlFile, Function<String, String> envProvider) throws IOException {
        String content = Files.readString(yamlFile);
        logger.debug("Loading queue configuration from {}", yamlFile);
        return mapper.readValue(resolveVariables(content, envProvider), FifoYamlConfig.class);
    }

    public static void save(Path yamlFile, FifoYamlConfig config) throws IOException {
        mapper.writeValue(yamlFile.toFile(), config);
    }

    /**
     * Converts a parsed file into queue options. Missing entries keep their defaults.
     *
     * @param yamlConfig parsed configuration
     * @return options ready to open a queue with
     * @throws IllegalArgumentException if the {@code fifo} section is missing or a value is invalid
     */
    public static BoundedFifo.Options convertToDomain(FifoYamlConfig yamlConfig) {
        FifoYamlConfig.FifoPolicyConfig fifo = yamlConfig.getFifo();
        if (fifo == null) {
            throw new IllegalArgumentException("fifo configuration is missing");
        }
        BoundedFifo.Options options = BoundedFifo.Options.defaults();

        if (fifo.getWeightUnit() != null) {
            options.withWeightUnit(parseEnum(TimeUnit.class, fifo.getWeightUnit(), "weight-unit"));
        }
        if (fifo.getOverflowPolicy() != null) {
            options.withOverflowPolicy(parseEnum(OverflowPolicy.class, fifo.getOverflowPolicy(), "overflow-policy"));
        }
        if (fifo.getCapacity() != null && fifo.getCapacityDuration() != null) {
            throw new IllegalArgumentException("capacity and capacity-duration are mutually exclusive");
        }
        if (fifo.getCapacity() != null) {
            options.withCapacity(fifo.getCapacity());
        } else if (fifo.getCapacityDuration() != null) {
            options.withCapacity(options.weightUnit().convert(parseDuration(fifo.getCapacityDuration())));
        }

        FifoYamlConfig.StatsConfig stats = fifo.getStats();
        if (stats != null) {
            options.withStats(stats.isEnabled());
            if (stats.getInterval() != null) {
                options.withStatsInterval(parseDuration(stats.getInterval()));
            }
        }
        return options;
    }

    private static String resolveVariables(String content, Function<String, String> envProvider) {
        Matcher matcher = PLACEHOLDER.matcher(content);
        StringBuilder builder = new StringBuilder();
        int i = 0;
        while (matcher.find()) {
            builder.append(content, i, matcher.start());
            builder.append(getReplacement(matcher.group(1), envProvider));
            i = matcher.end();
        }
        builder.append(content.substring(i));
        return builder.toString();
    }

    private static String getReplacement(String group, Function<String, String> envProvider) {
        String[] parts = group.split(":", 2);
        String value = envProvider.apply(parts[0]);
        if (value != null) {
            return value;
        }
        if (parts.length > 1) {
            return parts[1];
        }
        throw new IllegalArgumentException(
                "Environment variable or property '" + parts[0] + "' not found and no default value provided.");
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String raw, String key) {
        try {
            return Enum.valueOf(type, raw.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid " + key + ": " + raw, e);
        }
    }

    /**
     * Accepts ISO-8601 ({@code PT2S}) or a number followed by {@code ms}, {@code s}, {@code m} or {@code h}.
     */
    static Duration parseDuration(String raw) {
        String s = raw.trim().toUpperCase(Locale.ROOT);
        try {
            return Duration.parse(s);
        } catch (DateTimeParseException e) {
            try {
                if (s.endsWith("MS")) {
                    return Duration.ofMillis(Long.parseLong(s.substring(0, s.length() - 2)));
                } else if (s.endsWith("S")) {
                    return Duration.ofSeconds(Long.parseLong(s.substring(0, s.length() - 1)));
                } else if (s.endsWith("M")) {
                    return Duration.ofMinutes(Long.parseLong(s.substring(0, s.length() - 1)));
                } else if (s.endsWith("H")) {
                    return Duration.ofHours(Long.parseLong(s.substring(0, s.length() - 1)));
                }
                return Duration.ofMillis(Long.parseLong(s));
            } catch (NumberFormatException nfe) {
                throw new IllegalArgumentException("Invalid duration: " + raw, nfe);
            }
        }
    }
}

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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * YAML shape of a queue definition:
 *
 * <pre>
 * fifo:
 *   capacity: 5                 # strategy unit, or
 *   capacity-duration: 2s       # for timed queues, converted to weight-unit
 *   overflow-policy: REJECT     # REJECT | EVICT_OLDEST
 *   weight-unit: MILLISECONDS
 *   stats:
 *     enabled: true
 *     interval: 10s
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class FifoYamlConfig {

    @JsonProperty("fifo")
    private FifoPolicyConfig fifo;

    public FifoPolicyConfig getFifo() {
        return fifo;
    }

    public void setFifo(FifoPolicyConfig fifo) {
        this.fifo = fifo;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class FifoPolicyConfig {
        @JsonProperty("capacity")
        private Long capacity;
        @JsonProperty("capacity-duration")
        private String capacityDuration;
        @JsonProperty("overflow-policy")
        private String overflowPolicy;
        @JsonProperty("weight-unit")
        private String weightUnit;
        @JsonProperty("stats")
        private StatsConfig stats;

        public Long getCapacity() {
            return capacity;
        }

        public void setCapacity(Long capacity) {
            this.capacity = capacity;
        }

        public String getCapacityDuration() {
            return capacityDuration;
        }

        public void setCapacityDuration(String capacityDuration) {
            this.capacityDuration = capacityDuration;
        }

        public String getOverflowPolicy() {
            return overflowPolicy;
        }

        public void setOverflowPolicy(String overflowPolicy) {
            this.overflowPolicy = overflowPolicy;
        }

        public String getWeightUnit() {
            return weightUnit;
        }

        public void setWeightUnit(String weightUnit) {
            this.weightUnit = weightUnit;
        }

        public StatsConfig getStats() {
            return stats;
        }

        public void setStats(StatsConfig stats) {
            this.stats = stats;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StatsConfig {
        @JsonProperty("enabled")
        private boolean enabled = true;
        @JsonProperty("interval")
        private String interval;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getInterval() {
            return interval;
        }

        public void setInterval(String interval) {
            this.interval = interval;
        }
    }
}

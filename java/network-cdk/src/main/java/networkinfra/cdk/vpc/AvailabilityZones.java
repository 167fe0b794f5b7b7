/*
 * Copyright 2022-2025 Crown Copyright
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package networkinfra.cdk.vpc;

import networkinfra.cdk.config.AppContext;

import java.util.List;
import java.util.Locale;

import static networkinfra.cdk.config.AppParameters.AVAILABILITY_ZONE_SUFFIXES;

/**
 * The availability zones a network is laid out over, in order. Zones are given as suffixes of the region, e.g.
 * "a" for us-east-1a.
 */
public class AvailabilityZones {

    private final List<String> suffixes;

    private AvailabilityZones(List<String> suffixes) {
        if (suffixes.isEmpty()) {
            throw new IllegalArgumentException(AVAILABILITY_ZONE_SUFFIXES.key() + " must contain at least one zone");
        }
        this.suffixes = suffixes;
    }

    public static AvailabilityZones from(AppContext context) {
        return new AvailabilityZones(context.get(AVAILABILITY_ZONE_SUFFIXES));
    }

    public int count() {
        return suffixes.size();
    }

    public String zoneName(String region, int index) {
        return region + suffixes.get(index);
    }

    public List<String> zoneNames(String region) {
        return suffixes.stream().map(suffix -> region + suffix).toList();
    }

    /**
     * Identifies a zone in construct IDs and name tags, e.g. "A" for the zone with suffix "a".
     *
     * @param  index the index of the zone
     * @return       the zone's label
     */
    public String label(int index) {
        return suffixes.get(index).toUpperCase(Locale.ROOT);
    }

    List<String> suffixes() {
        return suffixes;
    }
}

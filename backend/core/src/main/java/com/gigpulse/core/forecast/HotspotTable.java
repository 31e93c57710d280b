package com.gigpulse.core.forecast;

import com.gigpulse.core.model.Category;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

public final class HotspotTable {
    public enum HourBucket {
        COMMUTE,
        MEAL,
        NIGHTLIFE,
        DEFAULT
    }

    private static final Set<Integer> COMMUTE_HOURS = Set.of(7, 8, 9, 16, 17, 18, 19);
    private static final Set<Integer> MEAL_HOURS = Set.of(11, 12, 13, 17, 18, 19, 20);
    private static final Set<Integer> NIGHTLIFE_HOURS = Set.of(21, 22, 23, 0, 1, 2);

    private final Map<Category, List<HourBucket>> priority = new EnumMap<>(Category.class);
    private final Map<Category, Map<HourBucket, String>> labels = new EnumMap<>(Category.class);

    public HotspotTable() {
        priority.put(Category.RIDESHARE, List.of(HourBucket.COMMUTE, HourBucket.NIGHTLIFE, HourBucket.MEAL));
        priority.put(Category.DELIVERY, List.of(HourBucket.MEAL, HourBucket.NIGHTLIFE, HourBucket.COMMUTE));

        Map<HourBucket, String> rideshare = new EnumMap<>(HourBucket.class);
        rideshare.put(HourBucket.COMMUTE, "Financial District / Commute Corridors");
        rideshare.put(HourBucket.MEAL, "Downtown / Business Districts");
        rideshare.put(HourBucket.NIGHTLIFE, "Nightlife Areas");
        rideshare.put(HourBucket.DEFAULT, "Downtown Core");
        labels.put(Category.RIDESHARE, rideshare);

        Map<HourBucket, String> delivery = new EnumMap<>(HourBucket.class);
        delivery.put(HourBucket.COMMUTE, "Coffee & Breakfast Spots");
        delivery.put(HourBucket.MEAL, "Restaurant Districts");
        delivery.put(HourBucket.NIGHTLIFE, "Late-Night Food Corridors");
        delivery.put(HourBucket.DEFAULT, "Residential Neighborhoods");
        labels.put(Category.DELIVERY, delivery);
    }

    public HourBucket bucketFor(Category category, int hour) {
        for (HourBucket bucket : priority.get(category)) {
            if (hoursOf(bucket).contains(hour)) {
                return bucket;
            }
        }
        return HourBucket.DEFAULT;
    }

    public String hotspot(Category category, int hour) {
        return labels.get(category).get(bucketFor(category, hour));
    }

    private static Set<Integer> hoursOf(HourBucket bucket) {
        if (bucket == HourBucket.COMMUTE) {
            return COMMUTE_HOURS;
        }
        if (bucket == HourBucket.MEAL) {
            return MEAL_HOURS;
        }
        if (bucket == HourBucket.NIGHTLIFE) {
            return NIGHTLIFE_HOURS;
        }
        return Set.of();
    }
}

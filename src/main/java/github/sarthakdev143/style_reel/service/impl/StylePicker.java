package github.sarthakdev143.style_reel.service.impl;

import github.sarthakdev143.style_reel.config.StyleReelProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

@Component
public class StylePicker {

    private final List<String> catalog;
    private final Random random;

    @Autowired
    public StylePicker(StyleReelProperties properties) {
        this(properties.generation().styles(), new SecureRandom());
    }

    StylePicker(List<String> catalog, Random random) {
        this.catalog = List.copyOf(catalog);
        this.random = random;
    }

    public List<String> pick(List<String> requested, int count) {
        Set<String> chosen = new LinkedHashSet<>();
        if (requested != null) {
            for (String style : requested) {
                if (style != null && !style.isBlank()) {
                    chosen.add(style.trim());
                }
            }
        }

        List<String> picked = new ArrayList<>(chosen);
        if (picked.size() >= count) {
            return List.copyOf(picked.subList(0, count));
        }

        List<String> remaining = new ArrayList<>();
        for (String style : catalog) {
            if (!chosen.contains(style)) {
                remaining.add(style);
            }
        }
        while (picked.size() < count && !remaining.isEmpty()) {
            picked.add(remaining.remove(random.nextInt(remaining.size())));
        }

        if (picked.size() < count) {
            throw new IllegalArgumentException(
                    "Only " + picked.size() + " distinct styles are available for a style count of " + count + ".");
        }
        return List.copyOf(picked);
    }
}

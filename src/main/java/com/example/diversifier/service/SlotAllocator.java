package com.example.diversifier.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.function.Function;

/**
 * Splits {@code n} slots over an ordered list of categories.
 *
 * <p>Each category first gets {@code n / k}, the first {@code n % k} categories one more.
 * A category that cannot fill its share passes the shortfall on to the next one; slots
 * still open after the last category are offered again from the first. An item id is
 * never picked twice, even when several categories carry it.
 */
@Component
public class SlotAllocator {

    private static final Logger logger = LoggerFactory.getLogger(SlotAllocator.class);

    /**
     * @param eligibleItems eligible ids of a category, in supplier order
     * @return picked ids per category, in category order; every category is present
     */
    public Map<String, List<String>> allocate(List<String> categories, int n,
                                              Function<String, List<String>> eligibleItems) {
        Map<String, List<String>> picks = new LinkedHashMap<>();
        if (categories.isEmpty() || n <= 0) {
            categories.forEach(category -> picks.put(category, new ArrayList<>()));
            return picks;
        }

        int k = categories.size();
        int base = n / k;
        int extra = n % k;
        Set<String> taken = new HashSet<>();

        int carry = 0;
        for (int i = 0; i < k; i++) {
            String category = categories.get(i);
            int wanted = base + (i < extra ? 1 : 0) + carry;
            List<String> picked = new ArrayList<>();
            picks.put(category, picked);
            carry = wanted - take(eligibleItems.apply(category), wanted, taken, picked);
        }

        if (carry > 0) {
            logger.debug("{} slots left after first pass, offering them again", carry);
            for (String category : categories) {
                if (carry == 0) {
                    break;
                }
                carry -= take(eligibleItems.apply(category), carry, taken, picks.get(category));
            }
        }
        if (carry > 0) {
            logger.debug("Categories {} exhausted, {} of {} slots filled", categories, n - carry, n);
        }
        return picks;
    }

    private static int take(List<String> eligible, int wanted, Set<String> taken, List<String> picked) {
        int got = 0;
        for (String id : eligible) {
            if (got == wanted) {
                break;
            }
            if (taken.add(id)) {
                picked.add(id);
                got++;
            }
        }
        return got;
    }
}

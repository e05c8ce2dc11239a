package com.hartwig.minijd.expansion;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Integer range expression: comma separated items, each a single value or {@code start-end[:step]}. The items together must
 * describe a strictly increasing sequence, so {@code "1-380:11,380"} expands to 1, 12, ..., 375, 380.
 */
public final class IntRangeExpression {
    private static final Pattern ITEM = Pattern.compile("^(-?\\d+)(?:\\s*-\\s*(-?\\d+)(?:\\s*:\\s*(-?\\d+))?)?$");

    private final String text;
    private final List<Item> items;
    private final long size;

    private IntRangeExpression(final String text, final List<Item> items, final long size) {
        this.text = text;
        this.items = items;
        this.size = size;
    }

    /**
     * @throws RangeExpansionException on malformed items, non-positive steps, decreasing bounds or items out of order
     */
    public static IntRangeExpression parse(String text) {
        if (text == null || text.isBlank()) {
            throw new RangeExpansionException("Range expression is empty");
        }
        var items = new ArrayList<Item>();
        long size = 0;
        Long previousLast = null;
        for (String rawItem : text.split(",", -1)) {
            var item = parseItem(rawItem.strip(), text);
            if (previousLast != null && item.start <= previousLast) {
                throw new RangeExpansionException(String.format("Range item '%s' in '%s' must start after %d, the last value before it",
                        rawItem.strip(),
                        text,
                        previousLast));
            }
            previousLast = item.last();
            items.add(item);
            try {
                size = Math.addExact(size, item.size);
            } catch (ArithmeticException e) {
                throw new RangeExpansionException(String.format("Range '%s' has more values than can be counted", text));
            }
        }
        return new IntRangeExpression(text, List.copyOf(items), size);
    }

    private static Item parseItem(String item, String text) {
        var matcher = ITEM.matcher(item);
        if (!matcher.matches()) {
            throw new RangeExpansionException(String.format("Malformed range item '%s' in '%s'", item, text));
        }
        try {
            var start = Long.parseLong(matcher.group(1));
            if (matcher.group(2) == null) {
                return new Item(start, start, 1, 1);
            }
            var end = Long.parseLong(matcher.group(2));
            var step = matcher.group(3) == null ? 1 : Long.parseLong(matcher.group(3));
            if (step <= 0) {
                throw new RangeExpansionException(String.format("Step of range '%s' in '%s' must be positive", item, text));
            }
            if (end < start) {
                throw new RangeExpansionException(String.format("Range '%s' in '%s' ends before it starts", item, text));
            }
            long size;
            try {
                size = Math.addExact(Math.subtractExact(end, start) / step, 1);
            } catch (ArithmeticException e) {
                throw new RangeExpansionException(String.format("Range '%s' in '%s' has more values than can be counted", item, text));
            }
            return new Item(start, end, step, size);
        } catch (NumberFormatException e) {
            throw new RangeExpansionException(String.format("Number out of range in '%s' of '%s'", item, text));
        }
    }

    public List<Long> expand() {
        var values = new ArrayList<Long>();
        for (Item item : items) {
            for (long value = item.start; value <= item.end; value += item.step) {
                values.add(value);
                if (value > Long.MAX_VALUE - item.step) {
                    break;
                }
            }
        }
        return values;
    }

    public long size() {
        return size;
    }

    @Override
    public String toString() {
        return text;
    }

    private static final class Item {
        private final long start;
        private final long end;
        private final long step;
        private final long size;

        private Item(final long start, final long end, final long step, final long size) {
            this.start = start;
            this.end = end;
            this.step = step;
            this.size = size;
        }

        long last() {
            return start + (size - 1) * step;
        }
    }
}

package eu.okaeri.docstore.document;

import lombok.NonNull;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Utility methods for extracting and comparing values from document maps.
 */
public final class DocumentValueUtils {

    private static final int OTHER_RANK = 6;

    private DocumentValueUtils() {
    }

    /**
     * Split a dotted field name into path parts.
     *
     * @param field the field name (e.g., "photo_requirements.size")
     * @return the path parts
     */
    public static List<String> toParts(@NonNull String field) {
        return Arrays.asList(field.split("\\."));
    }

    /**
     * Check whether a key path is present in a nested map.
     * A present key holding {@code null} counts as present.
     *
     * @param map   the map to inspect
     * @param parts the path parts
     * @return true if every part of the path exists
     */
    public static boolean hasPath(Map<?, ?> map, @NonNull List<String> parts) {
        Object current = map;

        for (String part : parts) {
            if (!(current instanceof Map)) {
                return false;
            }
            Map<?, ?> currentMap = (Map<?, ?>) current;
            if (!currentMap.containsKey(part)) {
                return false;
            }
            current = currentMap.get(part);
        }

        return true;
    }

    /**
     * Extract a value from a nested map using a path.
     *
     * @param map   the map to extract from
     * @param parts the path parts (e.g., ["photo_requirements", "size"])
     * @return the value at the path, or null if not found
     */
    public static Object extractValue(Map<?, ?> map, @NonNull List<String> parts) {
        Object current = map;

        for (String part : parts) {
            if (!(current instanceof Map)) {
                return null;
            }
            current = ((Map<?, ?>) current).get(part);
            if (current == null) {
                return null;
            }
        }

        return current;
    }

    /**
     * Compare two values for equality by value.
     * Numbers compare numerically regardless of their boxed type, mappings
     * and lists compare element by element with the same rule.
     *
     * @param value1 first value
     * @param value2 second value
     * @return true if values are equal
     */
    public static boolean valueEquals(Object value1, Object value2) {
        if ((value1 == null) || (value2 == null)) {
            return (value1 == null) && (value2 == null);
        }

        if ((value1 instanceof Number) && (value2 instanceof Number)) {
            return compareNumbers((Number) value1, (Number) value2) == 0;
        }

        if ((value1 instanceof Map) && (value2 instanceof Map)) {
            Map<?, ?> map1 = (Map<?, ?>) value1;
            Map<?, ?> map2 = (Map<?, ?>) value2;
            if (map1.size() != map2.size()) {
                return false;
            }
            for (Map.Entry<?, ?> entry : map1.entrySet()) {
                if (!map2.containsKey(entry.getKey()) || !valueEquals(entry.getValue(), map2.get(entry.getKey()))) {
                    return false;
                }
            }
            return true;
        }

        if ((value1 instanceof List) && (value2 instanceof List)) {
            List<?> list1 = (List<?>) value1;
            List<?> list2 = (List<?>) value2;
            if (list1.size() != list2.size()) {
                return false;
            }
            Iterator<?> iterator1 = list1.iterator();
            Iterator<?> iterator2 = list2.iterator();
            while (iterator1.hasNext()) {
                if (!valueEquals(iterator1.next(), iterator2.next())) {
                    return false;
                }
            }
            return true;
        }

        return Objects.equals(value1, value2);
    }

    /**
     * Hash code consistent with {@link #valueEquals(Object, Object)}:
     * values that compare equal by value hash equally.
     *
     * @param value the value to hash
     * @return the hash code
     */
    public static int valueHash(Object value) {
        if (value == null) {
            return 0;
        }

        if (value instanceof Number) {
            Number number = (Number) value;
            if (!isFinite(number)) {
                return Double.hashCode(number.doubleValue());
            }
            return toBigDecimal(number).stripTrailingZeros().hashCode();
        }

        if (value instanceof Map) {
            int hash = 0;
            for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
                hash += Objects.hashCode(entry.getKey()) ^ valueHash(entry.getValue());
            }
            return hash;
        }

        if (value instanceof List) {
            int hash = 1;
            for (Object element : (List<?>) value) {
                hash = (31 * hash) + valueHash(element);
            }
            return hash;
        }

        return value.hashCode();
    }

    /**
     * Compare two values for sorting. This is a total order over all values:
     * {@code null} first, then values of different types by {@link #typeRank(Object)}.
     * Values of otherwise unknown types order by class name, then naturally.
     * <p>
     * Callers that want missing fields to sort as a zero value substitute it
     * once per sort key (see {@link #zeroValueLike(Object)}) before comparing.
     *
     * @param value1 first value
     * @param value2 second value
     * @return negative if value1 &lt; value2, 0 if equal, positive if value1 &gt; value2
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    public static int compareForSort(Object value1, Object value2) {
        int rank1 = typeRank(value1);
        int rank2 = typeRank(value2);
        if (rank1 != rank2) {
            return Integer.compare(rank1, rank2);
        }
        if (value1 == null) {
            return 0;
        }

        if ((value1 instanceof Number) && (value2 instanceof Number)) {
            return compareNumbers((Number) value1, (Number) value2);
        }

        if ((rank1 == OTHER_RANK) && (value1.getClass() != value2.getClass())) {
            int byClass = value1.getClass().getName().compareTo(value2.getClass().getName());
            if (byClass != 0) {
                return byClass;
            }
        }

        if ((value1 instanceof Comparable) && (value1.getClass() == value2.getClass())) {
            return ((Comparable) value1).compareTo(value2);
        }

        return String.valueOf(value1).compareTo(String.valueOf(value2));
    }

    /**
     * Zero value matching the type of a reference value, used for missing fields.
     *
     * @param reference a present value of the sort key
     * @return "", 0, false, or null when no zero value applies
     */
    public static Object zeroValueLike(Object reference) {
        if (reference instanceof String) return "";
        if (reference instanceof Number) return 0;
        if (reference instanceof Boolean) return false;
        return null;
    }

    /**
     * Cross-type sort rank, following the document store comparison order:
     * null, numbers, strings, mappings, lists, booleans, everything else.
     */
    public static int typeRank(Object value) {
        if (value == null) return 0;
        if (value instanceof Number) return 1;
        if (value instanceof CharSequence) return 2;
        if (value instanceof Map) return 3;
        if (value instanceof List) return 4;
        if (value instanceof Boolean) return 5;
        return OTHER_RANK;
    }

    private static int compareNumbers(Number number1, Number number2) {
        if (!isFinite(number1) || !isFinite(number2)) {
            return Double.compare(number1.doubleValue(), number2.doubleValue());
        }
        return toBigDecimal(number1).compareTo(toBigDecimal(number2));
    }

    private static boolean isFinite(Number number) {
        return !((number instanceof Double) || (number instanceof Float)) || Double.isFinite(number.doubleValue());
    }

    private static BigDecimal toBigDecimal(Number number) {
        if (number instanceof BigDecimal) {
            return (BigDecimal) number;
        }
        if ((number instanceof Double) || (number instanceof Float)) {
            return BigDecimal.valueOf(number.doubleValue());
        }
        return new BigDecimal(number.toString());
    }
}

package io.github.samzhu.eduhub.pipeline;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.bson.Document;
import org.bson.types.ObjectId;

/**
 * BSON 文件的欄位路徑存取與比較工具。
 *
 * <p>路徑以 {@code .} 分隔（如 {@code instructor_info.profile.bio}）。
 * 比較順序依 MongoDB 的 BSON 型別順序：
 * <pre>
 * null &lt; 數值 &lt; 字串 &lt; 物件 &lt; 陣列 &lt; ObjectId &lt; 布林 &lt; 日期
 * </pre>
 */
public final class Documents {

    private Documents() {
    }

    /**
     * 取得路徑上的值，不存在時回傳 null。
     *
     * <p>路徑中間遇到陣列時，對每個元素取值並收集成陣列（與 MongoDB 欄位路徑語意相同）。
     */
    public static Object resolve(Map<?, ?> document, String path) {
        if (document == null) {
            return null;
        }
        int dot = path.indexOf('.');
        if (dot < 0) {
            return document.get(path);
        }
        Object head = document.get(path.substring(0, dot));
        String rest = path.substring(dot + 1);
        return resolveValue(head, rest);
    }

    private static Object resolveValue(Object value, String path) {
        if (value instanceof Map<?, ?> map) {
            return resolve(map, path);
        }
        if (value instanceof List<?> list) {
            List<Object> values = new ArrayList<>();
            for (Object element : list) {
                if (element instanceof Map<?, ?> map && contains(map, path)) {
                    values.add(resolve(map, path));
                }
            }
            return values;
        }
        return null;
    }

    /**
     * 路徑是否存在（值可為 null）。
     */
    public static boolean contains(Map<?, ?> document, String path) {
        if (document == null) {
            return false;
        }
        int dot = path.indexOf('.');
        if (dot < 0) {
            return document.containsKey(path);
        }
        Object head = document.get(path.substring(0, dot));
        return head instanceof Map<?, ?> map && contains(map, path.substring(dot + 1));
    }

    /**
     * 回傳設定了路徑值的新文件，原文件與沿途的子文件都不會被修改。
     */
    public static Document with(Document document, String path, Object value) {
        Document copy = new Document(document);
        int dot = path.indexOf('.');
        if (dot < 0) {
            copy.put(path, value);
            return copy;
        }
        String head = path.substring(0, dot);
        Object child = copy.get(head);
        Document childDocument = child instanceof Map<?, ?> map ? toDocument(map) : new Document();
        copy.put(head, with(childDocument, path.substring(dot + 1), value));
        return copy;
    }

    /**
     * 回傳移除了頂層欄位的新文件。
     */
    public static Document without(Document document, String field) {
        Document copy = new Document(document);
        copy.remove(field);
        return copy;
    }

    /**
     * 將任意 Map（如 JSON 讀入的巢狀物件）轉為 {@link Document}，鍵一律轉為字串。
     */
    public static Document toDocument(Map<?, ?> map) {
        if (map instanceof Document document) {
            return document;
        }
        Document document = new Document();
        map.forEach((key, value) -> document.put(String.valueOf(key), value));
        return document;
    }

    /**
     * 以 MongoDB 語意比較兩個值是否相等（{@code 1} 與 {@code 1.0} 視為相等）。
     */
    public static boolean valuesEqual(Object left, Object right) {
        if (left instanceof Number && right instanceof Number) {
            return compare(left, right) == 0;
        }
        return Objects.equals(normalizeDate(left), normalizeDate(right));
    }

    /**
     * 將值正規化為可作為 HashMap 鍵的形式，使 {@link #valuesEqual} 相等的值得到相同的鍵。
     */
    public static Object normalizeKey(Object value) {
        if (value instanceof Number number) {
            return isIntegral(number) ? (Object) number.longValue() : (Object) number.doubleValue();
        }
        return normalizeDate(value);
    }

    /**
     * 依 BSON 型別順序比較，同型別再比較值。
     */
    public static int compare(Object left, Object right) {
        int rankCompare = Integer.compare(rank(left), rank(right));
        if (rankCompare != 0) {
            return rankCompare;
        }
        if (left == null) {
            return 0;
        }
        if (left instanceof Number l && right instanceof Number r) {
            if (isIntegral(l) && isIntegral(r)) {
                return Long.compare(l.longValue(), r.longValue());
            }
            return Double.compare(l.doubleValue(), r.doubleValue());
        }
        if (left instanceof String l && right instanceof String r) {
            return l.compareTo(r);
        }
        if (left instanceof Boolean l && right instanceof Boolean r) {
            return l.compareTo(r);
        }
        if (left instanceof ObjectId l && right instanceof ObjectId r) {
            return l.compareTo(r);
        }
        Object leftDate = normalizeDate(left);
        Object rightDate = normalizeDate(right);
        if (leftDate instanceof Date l && rightDate instanceof Date r) {
            return l.compareTo(r);
        }
        if (left instanceof Map<?, ?> l && right instanceof Map<?, ?> r) {
            return compareMaps(l, r);
        }
        if (left instanceof List<?> l && right instanceof List<?> r) {
            for (int i = 0; i < Math.min(l.size(), r.size()); i++) {
                int c = compare(l.get(i), r.get(i));
                if (c != 0) {
                    return c;
                }
            }
            return Integer.compare(l.size(), r.size());
        }
        return String.valueOf(left).compareTo(String.valueOf(right));
    }

    private static int compareMaps(Map<?, ?> left, Map<?, ?> right) {
        List<Object> leftKeys = new ArrayList<>(left.keySet());
        List<Object> rightKeys = new ArrayList<>(right.keySet());
        for (int i = 0; i < Math.min(leftKeys.size(), rightKeys.size()); i++) {
            int c = String.valueOf(leftKeys.get(i)).compareTo(String.valueOf(rightKeys.get(i)));
            if (c != 0) {
                return c;
            }
            c = compare(left.get(leftKeys.get(i)), right.get(rightKeys.get(i)));
            if (c != 0) {
                return c;
            }
        }
        return Integer.compare(leftKeys.size(), rightKeys.size());
    }

    private static int rank(Object value) {
        if (value == null) {
            return 1;
        }
        if (value instanceof Number) {
            return 2;
        }
        if (value instanceof String) {
            return 3;
        }
        if (value instanceof Map<?, ?>) {
            return 4;
        }
        if (value instanceof List<?>) {
            return 5;
        }
        if (value instanceof ObjectId) {
            return 7;
        }
        if (value instanceof Boolean) {
            return 8;
        }
        if (value instanceof Date || value instanceof Instant) {
            return 9;
        }
        return 10;
    }

    static boolean isIntegral(Number number) {
        return number instanceof Integer || number instanceof Long
            || number instanceof Short || number instanceof Byte;
    }

    static Object normalizeDate(Object value) {
        return value instanceof Instant instant ? Date.from(instant) : value;
    }
}

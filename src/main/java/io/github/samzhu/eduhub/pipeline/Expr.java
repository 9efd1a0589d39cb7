package io.github.samzhu.eduhub.pipeline;

import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Arrays;
import java.util.Date;
import java.util.List;
import java.util.Map;

import org.bson.Document;

/**
 * Aggregation 運算式。
 *
 * <p>每個運算式可以：
 * <ul>
 *   <li>{@link #evaluate(Document)} - 對單一文件求值（記憶體內執行）</li>
 *   <li>{@link #toBson()} - 轉為 MongoDB aggregation 運算式</li>
 * </ul>
 *
 * <p>支援的運算式：欄位路徑、常數、{@code $size}、{@code $multiply}、{@code $concat}、
 * {@code $cond} + {@code $eq}、{@code $year}、{@code $month}、物件建構。
 */
public interface Expr {

    Object evaluate(Document document);

    Object toBson();

    static Expr field(String path) {
        return new FieldRef(path);
    }

    static Expr literal(Object value) {
        return new Literal(value);
    }

    static Expr size(Expr array) {
        return new Size(array);
    }

    static Expr multiply(Expr... factors) {
        return new Multiply(List.of(factors));
    }

    static Expr concat(Expr... parts) {
        return new Concat(List.of(parts));
    }

    static Expr condEq(Expr left, Object right, Object then, Object otherwise) {
        return new CondEq(left, right, then, otherwise);
    }

    static Expr year(Expr date) {
        return new DatePart("$year", date);
    }

    static Expr month(Expr date) {
        return new DatePart("$month", date);
    }

    static Expr object(NamedFields<Expr> fields) {
        return new ObjectExpr(fields.toMap());
    }

    /**
     * 欄位路徑，BSON 形式為 {@code "$path"}。
     */
    record FieldRef(String path) implements Expr {
        @Override
        public Object evaluate(Document document) {
            return Documents.resolve(document, path);
        }

        @Override
        public Object toBson() {
            return "$" + path;
        }
    }

    record Literal(Object value) implements Expr {
        @Override
        public Object evaluate(Document document) {
            return value;
        }

        @Override
        public Object toBson() {
            // 以 $ 開頭的字串會被當成欄位路徑
            if (value instanceof String s && s.startsWith("$")) {
                return new Document("$literal", s);
            }
            return value;
        }
    }

    /**
     * 陣列長度。非陣列（含缺少欄位）視為 0。
     */
    record Size(Expr array) implements Expr {
        @Override
        public Object evaluate(Document document) {
            return array.evaluate(document) instanceof List<?> list ? list.size() : 0;
        }

        @Override
        public Object toBson() {
            return new Document("$size", array.toBson());
        }
    }

    /**
     * 乘積。任一因子為 null 時結果為 null；全為整數時結果為 long，否則為 double。
     */
    record Multiply(List<Expr> factors) implements Expr {
        @Override
        public Object evaluate(Document document) {
            long longProduct = 1L;
            double doubleProduct = 1.0;
            boolean integral = true;
            for (Expr factor : factors) {
                Object value = factor.evaluate(document);
                if (!(value instanceof Number number)) {
                    return null;
                }
                integral &= Documents.isIntegral(number);
                longProduct *= number.longValue();
                doubleProduct *= number.doubleValue();
            }
            return integral ? (Object) longProduct : (Object) doubleProduct;
        }

        @Override
        public Object toBson() {
            return new Document("$multiply", factors.stream().map(Expr::toBson).toList());
        }
    }

    /**
     * 字串串接。任一部分為 null 時結果為 null。
     */
    record Concat(List<Expr> parts) implements Expr {
        @Override
        public Object evaluate(Document document) {
            StringBuilder result = new StringBuilder();
            for (Expr part : parts) {
                Object value = part.evaluate(document);
                if (value == null) {
                    return null;
                }
                if (!(value instanceof String s)) {
                    throw new IllegalArgumentException("$concat only supports strings, got: " + value.getClass().getSimpleName());
                }
                result.append(s);
            }
            return result.toString();
        }

        @Override
        public Object toBson() {
            return new Document("$concat", parts.stream().map(Expr::toBson).toList());
        }
    }

    /**
     * {@code $cond: [{$eq: [left, right]}, then, otherwise]}。
     */
    record CondEq(Expr left, Object right, Object then, Object otherwise) implements Expr {
        @Override
        public Object evaluate(Document document) {
            return Documents.valuesEqual(left.evaluate(document), right) ? then : otherwise;
        }

        @Override
        public Object toBson() {
            Document eq = new Document("$eq", Arrays.asList(left.toBson(), right));
            return new Document("$cond", Arrays.asList(eq, then, otherwise));
        }
    }

    /**
     * 日期的年或月（UTC）。值為 null 時結果為 null。
     */
    record DatePart(String operator, Expr date) implements Expr {
        @Override
        public Object evaluate(Document document) {
            Object value = Documents.normalizeDate(date.evaluate(document));
            if (!(value instanceof Date d)) {
                return null;
            }
            ZonedDateTime utc = d.toInstant().atZone(ZoneOffset.UTC);
            return "$year".equals(operator) ? utc.getYear() : utc.getMonthValue();
        }

        @Override
        public Object toBson() {
            return new Document(operator, date.toBson());
        }
    }

    /**
     * 物件建構，依宣告順序輸出欄位。
     */
    record ObjectExpr(Map<String, Expr> fields) implements Expr {
        @Override
        public Object evaluate(Document document) {
            Document result = new Document();
            fields.forEach((name, expr) -> result.put(name, expr.evaluate(document)));
            return result;
        }

        @Override
        public Object toBson() {
            Document result = new Document();
            fields.forEach((name, expr) -> result.put(name, expr.toBson()));
            return result;
        }
    }
}

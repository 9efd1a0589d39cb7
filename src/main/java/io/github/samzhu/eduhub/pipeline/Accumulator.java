package io.github.samzhu.eduhub.pipeline;

import java.util.ArrayList;
import java.util.List;

import org.bson.Document;

/**
 * {@code $group} 累加器。
 *
 * <p>數值語意與 MongoDB 相同：
 * <ul>
 *   <li>{@code $sum} 忽略非數值，空集合為 0</li>
 *   <li>{@code $avg} 忽略非數值（含 null），沒有數值時為 null</li>
 *   <li>{@code $addToSet} 忽略 null，保留第一次出現的順序</li>
 * </ul>
 */
public interface Accumulator {

    Object accumulate(List<Document> bucket);

    Document toBson();

    static Accumulator sum(Expr expr) {
        return new Sum(expr);
    }

    static Accumulator count() {
        return new Sum(Expr.literal(1));
    }

    static Accumulator avg(Expr expr) {
        return new Avg(expr);
    }

    static Accumulator first(Expr expr) {
        return new First(expr);
    }

    static Accumulator push(Expr expr) {
        return new Push(expr);
    }

    static Accumulator addToSet(Expr expr) {
        return new AddToSet(expr);
    }

    record Sum(Expr expr) implements Accumulator {
        @Override
        public Object accumulate(List<Document> bucket) {
            long longTotal = 0L;
            double doubleTotal = 0.0;
            boolean integral = true;
            for (Document document : bucket) {
                if (expr.evaluate(document) instanceof Number number) {
                    integral &= Documents.isIntegral(number);
                    longTotal += number.longValue();
                    doubleTotal += number.doubleValue();
                }
            }
            return integral ? (Object) longTotal : (Object) doubleTotal;
        }

        @Override
        public Document toBson() {
            return new Document("$sum", expr.toBson());
        }
    }

    record Avg(Expr expr) implements Accumulator {
        @Override
        public Object accumulate(List<Document> bucket) {
            double total = 0.0;
            int count = 0;
            for (Document document : bucket) {
                if (expr.evaluate(document) instanceof Number number) {
                    total += number.doubleValue();
                    count++;
                }
            }
            return count == 0 ? null : total / count;
        }

        @Override
        public Document toBson() {
            return new Document("$avg", expr.toBson());
        }
    }

    record First(Expr expr) implements Accumulator {
        @Override
        public Object accumulate(List<Document> bucket) {
            return bucket.isEmpty() ? null : expr.evaluate(bucket.get(0));
        }

        @Override
        public Document toBson() {
            return new Document("$first", expr.toBson());
        }
    }

    record Push(Expr expr) implements Accumulator {
        @Override
        public Object accumulate(List<Document> bucket) {
            List<Object> values = new ArrayList<>(bucket.size());
            bucket.forEach(document -> values.add(expr.evaluate(document)));
            return values;
        }

        @Override
        public Document toBson() {
            return new Document("$push", expr.toBson());
        }
    }

    record AddToSet(Expr expr) implements Accumulator {
        @Override
        public Object accumulate(List<Document> bucket) {
            List<Object> values = new ArrayList<>();
            for (Document document : bucket) {
                Object value = expr.evaluate(document);
                if (value != null && values.stream().noneMatch(v -> Documents.valuesEqual(v, value))) {
                    values.add(value);
                }
            }
            return values;
        }

        @Override
        public Document toBson() {
            return new Document("$addToSet", expr.toBson());
        }
    }
}

package io.github.samzhu.eduhub.pipeline;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

import org.bson.Document;

/**
 * {@code $sort} 依一個或多個欄位排序，排序為穩定排序。
 *
 * <p>null 與缺少的欄位小於任何值，因此降冪時排在最後。
 */
public record SortStage(List<SortKey> keys) implements Stage {

    public SortStage {
        if (keys.isEmpty()) {
            throw new IllegalArgumentException("$sort requires at least one key");
        }
        keys = List.copyOf(keys);
    }

    /**
     * 排序鍵。
     *
     * @param field 欄位路徑
     * @param ascending true 為升冪 (1)，false 為降冪 (-1)
     */
    public record SortKey(String field, boolean ascending) {

        public static SortKey asc(String field) {
            return new SortKey(field, true);
        }

        public static SortKey desc(String field) {
            return new SortKey(field, false);
        }

        Comparator<Document> comparator() {
            Comparator<Document> comparator = (left, right) ->
                Documents.compare(Documents.resolve(left, field), Documents.resolve(right, field));
            return ascending ? comparator : comparator.reversed();
        }
    }

    @Override
    public Stream<Document> apply(Stream<Document> input, LookupSource source) {
        Comparator<Document> comparator = keys.get(0).comparator();
        for (SortKey key : keys.subList(1, keys.size())) {
            comparator = comparator.thenComparing(key.comparator());
        }
        return input.sorted(comparator);
    }

    @Override
    public Document toDocument() {
        Document sort = new Document();
        keys.forEach(key -> sort.put(key.field(), key.ascending() ? 1 : -1));
        return new Document("$sort", sort);
    }
}

package se.fishmarket_be.util;

import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

public class PaginationUtils {

    public static final int DEFAULT_LIMIT = 20;
    public static final int MAX_LIMIT = 100;

    private PaginationUtils() {
    }

    public static Pageable createPageable(Integer limit, Integer offset) {
        return createPageable(limit, offset, Sort.unsorted());
    }

    public static Pageable createPageable(Integer limit, Integer offset, Sort sort) {
        int safeLimit = limit == null ? DEFAULT_LIMIT : Math.max(1, Math.min(limit, MAX_LIMIT));
        int safeOffset = offset == null ? 0 : Math.max(0, offset);
        return new OffsetBasedPageRequest(safeOffset, safeLimit, sort);
    }

    /**
     * Wraps a free-text term for a case-insensitive LIKE, escaping the wildcard characters.
     */
    public static String likePattern(String term) {
        String escaped = term.trim().toLowerCase()
                .replace("\\", "\\\\")
                .replace("%", "\\%")
                .replace("_", "\\_");
        return "%" + escaped + "%";
    }

    public static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}

package com.nesh.catalog.hierarchy;

import com.nesh.catalog.hierarchy.HierarchyBuildResult.SkippedRow;
import com.nesh.catalog.model.TariffLine;
import com.nesh.catalog.query.CodeFormats;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class HierarchyBuilder {
    private static final Logger logger = LoggerFactory.getLogger(HierarchyBuilder.class);

    public static final int CHAPTER_LEVEL = 0;
    public static final int EXCEPTION_LEVEL = 6;

    private static final int[] PARENT_LENGTHS = {7, 6, 5, 4, 2};
    private static final Comparator<Draft> DRAFT_ORDER = Comparator.comparing((Draft draft) -> draft.key)
        .thenComparing(draft -> draft.code)
        .thenComparing(draft -> nullToEmpty(draft.description))
        .thenComparing(draft -> nullToEmpty(draft.rate));

    public HierarchyBuildResult build(Collection<TariffLine> rows) {
        return build(rows, Set.of());
    }

    /**
     * Builds the tree in two passes: levels and parents once every row is known, then sort keys.
     * Headings whose chapter is in {@code knownChapters} may hang off the chapter without a chapter row.
     */
    public HierarchyBuildResult build(Collection<TariffLine> rows, Set<String> knownChapters) {
        List<SkippedRow> skipped = new ArrayList<>();
        List<Draft> drafts = new ArrayList<>();
        for (TariffLine row : rows) {
            Draft draft = parse(row, skipped);
            if (draft != null) {
                drafts.add(draft);
            }
        }
        drafts.sort(DRAFT_ORDER);

        Map<String, Draft> byKey = new LinkedHashMap<>();
        List<String> duplicates = new ArrayList<>();
        for (Draft draft : drafts) {
            if (byKey.putIfAbsent(draft.key, draft) != null) {
                duplicates.add(draft.key);
                logger.warn("hierarchy_duplicate_key key={} code={}", draft.key, draft.code);
            }
        }

        Map<String, Draft> numericByDigits = new HashMap<>();
        for (Draft draft : byKey.values()) {
            if (draft.exceptionIndex == null) {
                numericByDigits.put(draft.digits, draft);
            }
        }

        List<Draft> byDepth = new ArrayList<>(byKey.values());
        byDepth.sort(Comparator.comparing((Draft draft) -> draft.exceptionIndex != null)
            .thenComparingInt(draft -> draft.digits.length())
            .thenComparing(draft -> draft.key));

        List<String> orphans = new ArrayList<>();
        for (Draft draft : byDepth) {
            assignParentAndLevel(draft, numericByDigits);
            if (draft.parent == null && isOrphan(draft, knownChapters)) {
                orphans.add(draft.key);
                logger.warn("hierarchy_orphan key={} code={} level={}", draft.key, draft.code, draft.level);
            }
        }

        List<TariffNode> nodes = new ArrayList<>(byKey.size());
        for (Draft draft : byKey.values()) {
            nodes.add(new TariffNode(
                draft.key,
                draft.code,
                draft.digits,
                draft.exceptionIndex,
                draft.description,
                draft.rate,
                draft.level,
                draft.parent == null ? null : draft.parent.key,
                SortKeys.of(draft.digits, draft.exceptionIndex),
                draft.sourceCode,
                draft.sourceMarker
            ));
        }
        TariffTree tree = new TariffTree(nodes);
        orphans.sort(Comparator.naturalOrder());
        logger.info(
            "hierarchy_built nodes={} orphans={} skipped={} duplicates={}",
            tree.size(),
            orphans.size(),
            skipped.size(),
            duplicates.size()
        );
        return new HierarchyBuildResult(tree, List.copyOf(orphans), List.copyOf(skipped), List.copyOf(duplicates));
    }

    public static int structuralLevel(int digitCount) {
        if (digitCount <= 2) {
            return CHAPTER_LEVEL;
        }
        if (digitCount <= 4) {
            return 1;
        }
        if (digitCount == 5) {
            return 2;
        }
        if (digitCount == 6) {
            return 3;
        }
        return 4;
    }

    public static String keyOf(String digits, Integer exceptionIndex) {
        if (exceptionIndex == null) {
            return digits;
        }
        return digits + "-ex" + String.format("%02d", exceptionIndex);
    }

    private void assignParentAndLevel(Draft draft, Map<String, Draft> numericByDigits) {
        if (draft.exceptionIndex != null) {
            draft.parent = numericByDigits.get(draft.digits);
            draft.level = EXCEPTION_LEVEL;
            return;
        }
        for (int length : PARENT_LENGTHS) {
            if (length >= draft.digits.length()) {
                continue;
            }
            Draft candidate = numericByDigits.get(draft.digits.substring(0, length));
            if (candidate != null) {
                draft.parent = candidate;
                break;
            }
        }
        int level = structuralLevel(draft.digits.length());
        if (draft.parent != null && draft.parent.level >= level) {
            level = draft.parent.level + 1;
        }
        draft.level = level;
    }

    private boolean isOrphan(Draft draft, Set<String> knownChapters) {
        if (draft.exceptionIndex != null) {
            return true;
        }
        if (draft.level == CHAPTER_LEVEL) {
            return false;
        }
        return draft.digits.length() > 4 || !knownChapters.contains(draft.digits.substring(0, 2));
    }

    private Draft parse(TariffLine row, List<SkippedRow> skipped) {
        String rawCode = row.code() == null ? "" : row.code().trim();
        String marker = row.exceptionMarker() == null || row.exceptionMarker().isBlank()
            ? null
            : row.exceptionMarker().trim();
        String numericCode = rawCode;
        if (marker == null) {
            String[] exception = CodeFormats.splitException(rawCode);
            if (exception != null) {
                numericCode = exception[0];
                marker = exception[1];
            }
        }
        if (numericCode.isEmpty()) {
            skipped.add(new SkippedRow(row.code(), row.exceptionMarker(), "missing_code"));
            return null;
        }
        String digits = CodeFormats.clean(numericCode);
        if (digits.length() < CodeFormats.MIN_DIGITS
            || digits.length() > CodeFormats.MAX_DIGITS
            || digits.length() == 3) {
            skipped.add(new SkippedRow(row.code(), row.exceptionMarker(), "malformed_code"));
            logger.warn("hierarchy_row_skipped code={} reason=malformed_code", row.code());
            return null;
        }
        Integer exceptionIndex = null;
        if (marker != null) {
            exceptionIndex = CodeFormats.parseExceptionIndex(marker);
            if (exceptionIndex == null) {
                skipped.add(new SkippedRow(row.code(), row.exceptionMarker(), "invalid_exception_marker"));
                logger.warn("hierarchy_row_skipped code={} marker={} reason=invalid_exception_marker", row.code(), marker);
                return null;
            }
        }
        Draft draft = new Draft();
        draft.digits = digits;
        draft.exceptionIndex = exceptionIndex;
        draft.key = keyOf(digits, exceptionIndex);
        draft.code = exceptionIndex == null
            ? numericCode
            : numericCode + " Ex " + String.format("%02d", exceptionIndex);
        draft.description = row.description();
        draft.rate = row.rate();
        draft.sourceCode = row.code();
        draft.sourceMarker = row.exceptionMarker();
        return draft;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private static final class Draft {
        private String key;
        private String code;
        private String digits;
        private Integer exceptionIndex;
        private String description;
        private String rate;
        private int level;
        private Draft parent;
        private String sourceCode;
        private String sourceMarker;
    }
}

package ai.cv.composer.style;

import ai.cv.composer.layout.BlockKind;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable mapping from every {@link BlockKind} to its {@link StyleDescriptor}. This table is the only place
 * presentation values are defined; swap the sheet to re-theme a document.
 */
public final class StyleSheet {

    private static final String GRID_GREY = "#808080";
    private static final String HEADER_LIGHT_GREY = "#D3D3D3";

    private static final StyleSheet STANDARD = buildStandard();

    private final Map<BlockKind, StyleDescriptor> styles;

    private StyleSheet(Map<BlockKind, StyleDescriptor> styles) {
        EnumMap<BlockKind, StyleDescriptor> copy = new EnumMap<>(BlockKind.class);
        styles.forEach((kind, descriptor) -> copy.put(
                Objects.requireNonNull(kind, "kind"),
                Objects.requireNonNull(descriptor, "descriptor")));
        Set<BlockKind> missing = EnumSet.allOf(BlockKind.class);
        missing.removeAll(copy.keySet());
        if (!missing.isEmpty()) {
            throw new IllegalArgumentException("Style sheet is missing styles for " + missing);
        }
        this.styles = Collections.unmodifiableMap(copy);
    }

    public static StyleSheet of(Map<BlockKind, StyleDescriptor> styles) {
        return new StyleSheet(Objects.requireNonNull(styles, "styles"));
    }

    /**
     * Default CV theme: a large bold name, uppercase section headings, compact body text and a grey grid for tables.
     */
    public static StyleSheet standard() {
        return STANDARD;
    }

    public StyleDescriptor styleFor(BlockKind kind) {
        return styles.get(Objects.requireNonNull(kind, "kind"));
    }

    public StyleSheet withStyle(BlockKind kind, StyleDescriptor descriptor) {
        EnumMap<BlockKind, StyleDescriptor> copy = new EnumMap<>(styles);
        copy.put(Objects.requireNonNull(kind, "kind"), Objects.requireNonNull(descriptor, "descriptor"));
        return new StyleSheet(copy);
    }

    public Map<BlockKind, StyleDescriptor> asMap() {
        return styles;
    }

    private static StyleSheet buildStandard() {
        EnumMap<BlockKind, StyleDescriptor> styles = new EnumMap<>(BlockKind.class);
        styles.put(BlockKind.TITLE, StyleDescriptor.builder()
                .weight(FontWeight.BOLD)
                .size(SizeTier.TITLE)
                .spacingAfter(18)
                .build());
        styles.put(BlockKind.HEADING, StyleDescriptor.builder()
                .weight(FontWeight.BOLD)
                .size(SizeTier.HEADING)
                .spacingBefore(12)
                .spacingAfter(6)
                .uppercase(true)
                .build());
        styles.put(BlockKind.BULLET, StyleDescriptor.builder()
                .spacingAfter(1)
                .leftIndent(12)
                .bulletGlyph("•")
                .build());
        styles.put(BlockKind.PARAGRAPH, StyleDescriptor.builder()
                .spacingAfter(2)
                .build());
        styles.put(BlockKind.SPACER, StyleDescriptor.builder()
                .spacingAfter(6)
                .build());
        styles.put(BlockKind.TABLE, StyleDescriptor.builder()
                .spacingAfter(6)
                .tableStyle(new TableStyle(0.5, GRID_GREY, Optional.of(HEADER_LIGHT_GREY), 4, 2, true))
                .build());
        return new StyleSheet(styles);
    }
}

package ai.cv.composer.style;

import java.util.Objects;
import java.util.Optional;

/**
 * Presentation attributes attached to a block. Spacing and indent values are in points.
 */
public record StyleDescriptor(FontWeight weight,
                              SizeTier size,
                              double spacingBefore,
                              double spacingAfter,
                              double leftIndent,
                              TextAlignment alignment,
                              boolean uppercase,
                              Optional<String> bulletGlyph,
                              Optional<TableStyle> tableStyle) {

    public StyleDescriptor {
        weight = Objects.requireNonNull(weight, "weight");
        size = Objects.requireNonNull(size, "size");
        alignment = Objects.requireNonNull(alignment, "alignment");
        if (spacingBefore < 0 || spacingAfter < 0 || leftIndent < 0) {
            throw new IllegalArgumentException("Spacing and indent must not be negative");
        }
        bulletGlyph = bulletGlyph == null ? Optional.empty() : bulletGlyph;
        tableStyle = tableStyle == null ? Optional.empty() : tableStyle;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .weight(weight)
                .size(size)
                .spacingBefore(spacingBefore)
                .spacingAfter(spacingAfter)
                .leftIndent(leftIndent)
                .alignment(alignment)
                .uppercase(uppercase)
                .bulletGlyph(bulletGlyph.orElse(null))
                .tableStyle(tableStyle.orElse(null));
    }

    public static final class Builder {
        private FontWeight weight = FontWeight.NORMAL;
        private SizeTier size = SizeTier.BODY;
        private double spacingBefore;
        private double spacingAfter;
        private double leftIndent;
        private TextAlignment alignment = TextAlignment.LEFT;
        private boolean uppercase;
        private String bulletGlyph;
        private TableStyle tableStyle;

        private Builder() {
        }

        public Builder weight(FontWeight weight) {
            this.weight = weight;
            return this;
        }

        public Builder size(SizeTier size) {
            this.size = size;
            return this;
        }

        public Builder spacingBefore(double spacingBefore) {
            this.spacingBefore = spacingBefore;
            return this;
        }

        public Builder spacingAfter(double spacingAfter) {
            this.spacingAfter = spacingAfter;
            return this;
        }

        public Builder leftIndent(double leftIndent) {
            this.leftIndent = leftIndent;
            return this;
        }

        public Builder alignment(TextAlignment alignment) {
            this.alignment = alignment;
            return this;
        }

        public Builder uppercase(boolean uppercase) {
            this.uppercase = uppercase;
            return this;
        }

        public Builder bulletGlyph(String bulletGlyph) {
            this.bulletGlyph = bulletGlyph;
            return this;
        }

        public Builder tableStyle(TableStyle tableStyle) {
            this.tableStyle = tableStyle;
            return this;
        }

        public StyleDescriptor build() {
            return new StyleDescriptor(weight, size, spacingBefore, spacingAfter, leftIndent, alignment, uppercase,
                    Optional.ofNullable(bulletGlyph), Optional.ofNullable(tableStyle));
        }
    }
}

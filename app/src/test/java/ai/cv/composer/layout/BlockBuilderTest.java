package ai.cv.composer.layout;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class BlockBuilderTest {

    private final BlockBuilder builder = new DefaultBlockBuilder();

    @Test
    void emptyInputYieldsNoBlocks() {
        assertThat(builder.build("")).isEmpty();
        assertThat(builder.build(null)).isEmpty();
    }

    @Test
    void closesTableOnFollowingParagraph() {
        List<Block> blocks = builder.build("| a | b |\n| c | d |\nEND");

        assertThat(blocks).containsExactly(
                Block.table(List.of(List.of("a", "b"), List.of("c", "d"))),
                Block.paragraph("END"));
    }

    @Test
    void flushesTrailingTable() {
        assertThat(builder.build("| a | b |")).containsExactly(Block.table(List.of(List.of("a", "b"))));
        assertThat(builder.build("| a | b |\n")).containsExactly(Block.table(List.of(List.of("a", "b"))));
    }

    @Test
    void keepsEveryBlankLineAsSpacer() {
        assertThat(builder.build("A\n\nB")).containsExactly(Block.paragraph("A"), Block.spacer(), Block.paragraph("B"));
        assertThat(builder.build("A\n\n\nB")).containsExactly(
                Block.paragraph("A"), Block.spacer(), Block.spacer(), Block.paragraph("B"));
    }

    @Test
    void blankLineSplitsTables() {
        List<Block> blocks = builder.build("| a | b |\n\n| c | d |");

        assertThat(blocks).containsExactly(
                Block.table(List.of(List.of("a", "b"))),
                Block.spacer(),
                Block.table(List.of(List.of("c", "d"))));
    }

    @Test
    void acceptsWindowsAndOldMacLineEndings() {
        assertThat(builder.build("# Name\r\n- one\r- two")).containsExactly(
                Block.title("Name"), Block.bullet("one"), Block.bullet("two"));
    }

    @Test
    void keepsSeparatorRowsAndRaggedRowsAsData() {
        Block table = builder.build("| Language | Level |\n|---|---|\n| English | C1 | extra |").get(0);

        assertThat(table.kind()).isEqualTo(BlockKind.TABLE);
        assertThat(table.rows()).containsExactly(
                List.of("Language", "Level"),
                List.of("---", "---"),
                List.of("English", "C1", "extra"));
        assertThat(table.columnCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("Non-blank lines map to text blocks in the same order")
    void preservesSourceOrder() {
        String input = "# Title\nintro\n## Section\n- first\n\n- second\n### deep\nclosing";

        List<String> texts = builder.build(input).stream()
                .filter(block -> block.kind().carriesText())
                .map(Block::text)
                .collect(Collectors.toList());

        assertThat(texts).containsExactly("Title", "intro", "Section", "first", "second", "### deep", "closing");
    }

    @Test
    void buildsCvScenario() {
        String input = """
                # Jane Doe
                ## SKILLS
                - Python
                - Rust

                ## LANGUAGES
                | Language | Level |
                | English | C1 |
                """;

        assertThat(builder.build(input)).containsExactly(
                Block.title("Jane Doe"),
                Block.heading("SKILLS"),
                Block.bullet("Python"),
                Block.bullet("Rust"),
                Block.spacer(),
                Block.heading("LANGUAGES"),
                Block.table(List.of(List.of("Language", "Level"), List.of("English", "C1"))));
    }

    @Test
    void everyLineContributesToExactlyOneBlock() {
        String input = "# T\n| a | b |\n| c | d |\n- x\n\ny\n| e | f |";

        List<Block> blocks = builder.build(input);

        int accounted = blocks.stream()
                .mapToInt(block -> block.kind() == BlockKind.TABLE ? block.rowCount() : 1)
                .sum();
        assertThat(accounted).isEqualTo((int) input.lines().count());
    }

    @Test
    void toleratesArbitraryGarbage() {
        String alphabet = "|#- \n\r\tab\u0000\u2028";
        Random random = new Random(42);
        for (int round = 0; round < 200; round++) {
            char[] chars = new char[random.nextInt(200)];
            for (int i = 0; i < chars.length; i++) {
                chars[i] = alphabet.charAt(random.nextInt(alphabet.length()));
            }
            String input = new String(chars);

            List<Block> blocks = builder.build(input);

            assertThat(blocks).doesNotContainNull();
            assertThat(blocks).allSatisfy(block -> {
                if (block.kind() == BlockKind.TABLE) {
                    assertThat(block.rows()).isNotEmpty();
                }
            });
        }
    }
}

package io.tablegen.generators.java.merge;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

public class PreservationMergerTest {

  private static final String TEMPLATE_V1 = """
      public class Order {
        private Long id;

        // <generator-preserve custom-1>
        // default
        // </generator-preserve custom-1>
      }
      """;

  private static final String TEMPLATE_V2 = """
      public class Order {
        private Long id;
        private String status;

        // <generator-preserve custom-1>
        // default
        // </generator-preserve custom-1>
      }
      """;

  @Test
  void noExistingFileReturnsGeneratedText() {
    MergeResult result = PreservationMerger.mergeDetailed(TEMPLATE_V1, null);

    assertThat(result.content()).isEqualTo(TEMPLATE_V1);
    assertThat(result.preservedIds()).isEmpty();
    assertThat(result.hasOrphans()).isFalse();
  }

  @Test
  void keepsDeveloperCodeAcrossTemplateChange() {
    String edited = TEMPLATE_V1.replace("  // default\n", "  public boolean isBig() { return id > 1000; }\n");

    MergeResult result = PreservationMerger.mergeDetailed(TEMPLATE_V2, edited);

    assertThat(result.content()).contains("private String status;");
    assertThat(result.content()).contains("public boolean isBig() { return id > 1000; }");
    assertThat(result.content()).doesNotContain("// default");
    assertThat(result.preservedIds()).containsExactly("custom-1");
  }

  @Test
  void untouchedBlockLeavesTemplateUnchanged() {
    assertThat(PreservationMerger.merge(TEMPLATE_V2, TEMPLATE_V1)).isEqualTo(TEMPLATE_V2);
  }

  @Test
  void mergingIsIdempotent() {
    String edited = TEMPLATE_V1.replace("  // default\n", "  int extra() { return 1; }\n");

    String once = PreservationMerger.merge(TEMPLATE_V2, edited);
    String twice = PreservationMerger.merge(TEMPLATE_V2, once);

    assertThat(twice).isEqualTo(once);
  }

  @Test
  void newBlockInTemplateKeepsDefaultBody() {
    String template = TEMPLATE_V2.replace("}\n", "") + """
          // <generator-preserve custom-2>
          // second default
          // </generator-preserve custom-2>
        }
        """;
    String edited = TEMPLATE_V1.replace("  // default\n", "  int extra() { return 1; }\n");

    MergeResult result = PreservationMerger.mergeDetailed(template, edited);

    assertThat(result.content()).contains("int extra() { return 1; }");
    assertThat(result.content()).contains("// second default");
    assertThat(result.preservedIds()).containsExactly("custom-1");
  }

  @Test
  void blockRemovedFromTemplateIsReportedAsOrphan() {
    String existing = """
        class A {
          // <generator-preserve custom-1>
          int one;
          // </generator-preserve custom-1>
          // <generator-preserve old-block>
          int legacy;
          // </generator-preserve old-block>
        }
        """;

    MergeResult result = PreservationMerger.mergeDetailed(TEMPLATE_V2, existing);

    assertThat(result.hasOrphans()).isTrue();
    assertThat(result.orphanedIds()).containsExactly("old-block");
    assertThat(result.content()).contains("int one;");
    assertThat(result.content()).doesNotContain("legacy");
  }

  @Test
  void emptiedBlockStaysEmpty() {
    String edited = TEMPLATE_V1.replace("  // default\n", "");

    String merged = PreservationMerger.merge(TEMPLATE_V2, edited);

    assertThat(merged).contains("// <generator-preserve custom-1>\n  // </generator-preserve custom-1>");
    assertThat(merged).doesNotContain("// default");
  }

  @Test
  void firstDuplicateBlockWins() {
    String existing = """
        // <generator-preserve custom-1>
        first
        // </generator-preserve custom-1>
        // <generator-preserve custom-1>
        second
        // </generator-preserve custom-1>
        """;

    String merged = PreservationMerger.merge(TEMPLATE_V1, existing);

    assertThat(merged).contains("first");
    assertThat(merged).doesNotContain("second");
  }

  @Test
  void unclosedBlockInExistingFileIsIgnored() {
    String existing = """
        // <generator-preserve custom-1>
        lost
        """;

    assertThat(PreservationMerger.merge(TEMPLATE_V1, existing)).isEqualTo(TEMPLATE_V1);
  }

  @Test
  void crlfExistingFileIsMerged() {
    String edited = TEMPLATE_V1.replace("  // default\n", "  int extra;\n").replace("\n", "\r\n");

    String merged = PreservationMerger.normalize(PreservationMerger.merge(TEMPLATE_V2, edited));

    assertThat(merged).contains("  int extra;\n");
    assertThat(merged).doesNotContain("\r");
  }

  @Test
  void normalizeUnifiesLineEndingsAndTrailingWhitespace() {
    assertThat(PreservationMerger.normalize("a\r\nb\rc  \n\n\n")).isEqualTo("a\nb\nc\n");
    assertThat(PreservationMerger.normalize("x")).isEqualTo("x\n");
    assertThat(PreservationMerger.normalize("")).isEqualTo("\n");
  }

  @Test
  void wellFormedMarkersHaveNoProblems() {
    assertThat(PreservationMerger.validateMarkers(TEMPLATE_V2)).isEmpty();
  }

  @Test
  void validateMarkersReportsStructuralProblems() {
    String text = """
        // </generator-preserve stray>
        // <generator-preserve a>
        // <generator-preserve b>
        // </generator-preserve b>
        // </generator-preserve a>
        // <generator-preserve a>
        // </generator-preserve x>
        // <generator-preserve open>
        """;

    List<String> problems = PreservationMerger.validateMarkers(text);

    assertThat(problems).anySatisfy(p -> assertThat(p).contains("line 1").contains("'stray' has no matching begin"));
    assertThat(problems).anySatisfy(p -> assertThat(p).contains("line 3").contains("opened inside block 'a'"));
    assertThat(problems).anySatisfy(p -> assertThat(p).contains("line 6").contains("duplicate block id 'a'"));
    assertThat(problems).anySatisfy(p -> assertThat(p).contains("line 7").contains("does not match open block 'a'"));
    assertThat(problems).anySatisfy(p -> assertThat(p).contains("line 8").contains("'open' is never closed"));
  }

  @Test
  void markerHelpersProduceLineComments() {
    assertThat(PreservationMerger.beginMarker("custom-methods")).isEqualTo("// <generator-preserve custom-methods>");
    assertThat(PreservationMerger.endMarker("custom-methods")).isEqualTo("// </generator-preserve custom-methods>");
  }
}

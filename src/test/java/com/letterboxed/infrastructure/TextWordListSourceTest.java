package com.letterboxed.infrastructure;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.FileSystemResource;

class TextWordListSourceTest {

  @Test
  void readsAndSanitizesEveryLine(@TempDir Path dir) throws Exception {
    Path file = dir.resolve("words.txt");
    Files.write(file, List.of("Who", "", "objectively", "well-being", "42", "  Lexicography  "),
        StandardCharsets.UTF_8);

    TextWordListSource source = new TextWordListSource(new FileSystemResource(file));

    assertThat(source.loadWords())
        .containsExactly("who", "objectively", "wellbeing", "lexicography");
    assertThat(source.describe()).contains("words.txt");
  }

  @Test
  void readsBundledClasspathList() {
    TextWordListSource source = new TextWordListSource(new ClassPathResource("word_list.txt"));
    assertThat(source.loadWords()).contains("who", "objectively", "lexicography").hasSizeGreaterThan(1000);
  }

  @Test
  void missingFileFailsLoudly(@TempDir Path dir) {
    TextWordListSource source = new TextWordListSource(new FileSystemResource(dir.resolve("nope.txt")));
    assertThatThrownBy(source::loadWords)
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("not found");
  }
}

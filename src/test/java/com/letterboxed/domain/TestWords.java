package com.letterboxed.domain;

import com.letterboxed.infrastructure.TextWordListSource;
import org.springframework.core.io.ClassPathResource;

/** The bundled English word list, loaded the way the service loads it. */
final class TestWords {
  private static Dictionary english;

  private TestWords() {}

  static synchronized Dictionary english() {
    if (english == null) {
      english =
          Dictionary.build(new TextWordListSource(new ClassPathResource("word_list.txt")).loadWords());
    }
    return english;
  }
}

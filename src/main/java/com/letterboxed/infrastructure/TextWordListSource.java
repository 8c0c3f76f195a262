package com.letterboxed.infrastructure;

import com.letterboxed.application.port.WordSource;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

/**
 * Word list read from a UTF-8 text resource, one entry per line.
 *
 * <p>The location is any Spring resource string ({@code classpath:word_list.txt}, {@code
 * file:/usr/share/dict/words}). Each line goes through {@link WordSanitizer}; lines left empty are
 * skipped.
 */
@Component
@ConditionalOnProperty(name = "letterboxed.word-source", havingValue = "text", matchIfMissing = true)
public class TextWordListSource implements WordSource {
  private static final Logger log = LoggerFactory.getLogger(TextWordListSource.class);

  private final Resource resource;

  public TextWordListSource(@Value("${letterboxed.word-list:classpath:word_list.txt}") Resource resource) {
    this.resource = resource;
  }

  @Override
  public List<String> loadWords() {
    if (!resource.exists()) {
      throw new IllegalStateException("Word list not found: " + resource.getDescription());
    }
    List<String> words = new ArrayList<>();
    int dropped = 0;
    try (BufferedReader in =
        new BufferedReader(new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
      String line;
      while ((line = in.readLine()) != null) {
        String w = WordSanitizer.sanitize(line);
        if (w.isEmpty()) {
          dropped++;
        } else {
          words.add(w);
        }
      }
    } catch (IOException e) {
      throw new IllegalStateException("Failed to read word list " + resource.getDescription(), e);
    }
    log.debug("Read {} words from {} ({} empty lines dropped)", words.size(), describe(), dropped);
    return words;
  }

  @Override
  public String describe() {
    return resource.getDescription();
  }
}

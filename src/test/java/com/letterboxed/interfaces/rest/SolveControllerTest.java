package com.letterboxed.interfaces.rest;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
class SolveControllerTest {
  @Autowired private MockMvc mvc;

  @Test
  void solvesABoard() throws Exception {
    mvc.perform(get("/solve").param("letters", "BTLEHYVCOIWJ").param("limit", "2"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.edges[0]").value("btl"))
        .andExpect(jsonPath("$.strategy").value("word"))
        .andExpect(jsonPath("$.maxExpansions").value(100000))
        .andExpect(jsonPath("$.solutions.length()").value(2))
        .andExpect(jsonPath("$.solutions[0].words[0]").value("who"))
        .andExpect(jsonPath("$.solutions[0].words[1]").value("objectively"))
        .andExpect(jsonPath("$.solutions[0].duplicateLetters").value(1));
  }

  @Test
  void solvesWithTheLetterWalk() throws Exception {
    mvc.perform(
            get("/solve").param("letters", "GIYERCPOLAHX").param("limit", "1").param("strategy", "letter"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.solutions[0].display").value("LEXICOGRAPHY"));
  }

  @Test
  void badBoardIsABadRequest() throws Exception {
    mvc.perform(get("/solve").param("letters", "ABCDE"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.type").value("error"))
        .andExpect(jsonPath("$.status").value(400));
  }

  @Test
  void unknownStrategyIsABadRequest() throws Exception {
    mvc.perform(get("/solve").param("letters", "BTLEHYVCOIWJ").param("strategy", "bfs"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void missingLettersIsABadRequest() throws Exception {
    mvc.perform(get("/solve")).andExpect(status().isBadRequest());
  }

  @Test
  void checksAWord() throws Exception {
    mvc.perform(get("/check").param("letters", "BTLEHYVCOIWJ").param("word", "bolt"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.word").value("bolt"))
        .andExpect(jsonPath("$.inDictionary").value(true))
        .andExpect(jsonPath("$.greedyPlayable").value(false))
        .andExpect(jsonPath("$.playable").value(false));
  }

  @Test
  void exposesConfiguration() throws Exception {
    mvc.perform(get("/config"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.minWordLength").value(3))
        .andExpect(jsonPath("$.numEdges").value(4))
        .andExpect(jsonPath("$.strategy").value("word"))
        .andExpect(jsonPath("$.maxExpansions").value(100000))
        .andExpect(jsonPath("$.protocolVersion").value(1));
  }
}

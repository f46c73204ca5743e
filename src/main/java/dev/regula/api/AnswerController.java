package dev.regula.api;

import dev.regula.answer.AnswerService;
import dev.regula.answer.FinalResponse;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST adapter over {@link AnswerService}. Invalid questions are mapped to 400 Problem Detail
 * responses by {@link dev.regula.config.GlobalExceptionHandler}.
 */
@RestController
@RequestMapping("/api/v1/answers")
public class AnswerController {

  private final AnswerService answerService;

  public AnswerController(AnswerService answerService) {
    this.answerService = answerService;
  }

  @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
  public ResponseEntity<FinalResponse> answer(@Valid @RequestBody AnswerRequest request) {
    return ResponseEntity.ok(answerService.answer(request.question()));
  }
}

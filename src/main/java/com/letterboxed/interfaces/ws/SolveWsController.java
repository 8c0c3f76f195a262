package com.letterboxed.interfaces.ws;

import com.letterboxed.application.SolveSessionService;
import com.letterboxed.dto.ErrorMessage;
import com.letterboxed.dto.SessionStartedMessage;
import com.letterboxed.dto.SolveReply;
import com.letterboxed.dto.StartSolveRequest;
import jakarta.validation.Valid;
import org.springframework.context.event.EventListener;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.MessageExceptionHandler;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.simp.annotation.SendToUser;
import org.springframework.stereotype.Controller;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

@Validated
@Controller
public class SolveWsController {
  private final SolveSessionService sessions;

  public SolveWsController(SolveSessionService sessions) {
    this.sessions = sessions;
  }

  @MessageMapping("/solve")
  @SendToUser("/queue/reply")
  public SessionStartedMessage solve(@Valid StartSolveRequest req, @Header("simpSessionId") String sid) {
    return sessions.start(sid, req.letters(), req.minWordLength(), req.strategy());
  }

  @MessageMapping("/next")
  @SendToUser("/queue/reply")
  public SolveReply next(@Header("simpSessionId") String sid) {
    return sessions.next(sid);
  }

  @MessageMapping("/exit")
  public void exit(@Header("simpSessionId") String sid) {
    sessions.end(sid);
  }

  @MessageExceptionHandler(Exception.class)
  @SendToUser("/queue/reply")
  public ErrorMessage onError(Exception e) {
    return new ErrorMessage(e.getMessage());
  }

  @EventListener
  public void onDisconnect(SessionDisconnectEvent e) {
    sessions.end(e.getSessionId());
  }
}

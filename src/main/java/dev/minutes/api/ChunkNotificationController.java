package dev.minutes.api;

import dev.minutes.intake.ChunkIntakeListener;
import dev.minutes.intake.IntakeResult;
import dev.minutes.intake.UploadNotification;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Receives object-created notifications for uploaded chunks.
 *
 * <p>Returns 200 for handled chunks and 202 for dropped, malformed keys (the notifier must not
 * retry those). Invalid chunks surface as 503 through {@code GlobalExceptionHandler}.
 */
@RestController
@RequestMapping("/api/notifications")
public class ChunkNotificationController {

  private final ChunkIntakeListener intakeListener;

  public ChunkNotificationController(ChunkIntakeListener intakeListener) {
    this.intakeListener = intakeListener;
  }

  @PostMapping("/chunks")
  public ResponseEntity<IntakeResult> chunkUploaded(
      @Valid @RequestBody UploadNotification notification) {
    IntakeResult result = intakeListener.onUpload(notification);
    if (!result.accepted()) {
      return ResponseEntity.accepted().body(result);
    }
    return ResponseEntity.ok(result);
  }
}

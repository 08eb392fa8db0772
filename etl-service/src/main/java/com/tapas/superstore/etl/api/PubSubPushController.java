package com.tapas.superstore.etl.api;

import com.tapas.superstore.etl.dto.PubSubPushRequest;
import com.tapas.superstore.etl.dto.PushResponse;
import com.tapas.superstore.etl.service.EtlOutcome;
import com.tapas.superstore.etl.service.SalesEtlPipeline;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.util.DigestUtils;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;

/**
 * Push endpoint for Pub/Sub style delivery. A 2xx response acknowledges the
 * message, anything else makes the broker redeliver it.
 */
@RestController
@RequestMapping("/api/pubsub")
public class PubSubPushController {

    private final SalesEtlPipeline pipeline;

    public PubSubPushController(SalesEtlPipeline pipeline) {
        this.pipeline = pipeline;
    }

    @Operation(
            summary = "Load one pushed sales message into the warehouse",
            description = "Decodes the base64 record, derives the order features and appends "
                    + "Customers, Products, Orders and OrderDetails.",
            responses = {
                    @ApiResponse(responseCode = "204", description = "Loaded, or already loaded by an earlier delivery"),
                    @ApiResponse(
                            responseCode = "200",
                            description = "Rejected as malformed; acknowledged so it is not redelivered",
                            content = @Content(
                                    mediaType = "application/json",
                                    schema = @Schema(implementation = PushResponse.class),
                                    examples = @ExampleObject(
                                            name = "rejectedExample",
                                            value = "{\n  \"messageId\": \"pubsub:42\",\n  \"status\": \"REJECTED\",\n  \"reason\": \"Record 0: missing required field 'Profit'\"\n}"
                                    )
                            )
                    ),
                    @ApiResponse(responseCode = "503", description = "Transient failure; redeliver")
            }
    )
    @PostMapping("/push")
    public ResponseEntity<PushResponse> push(@RequestBody @Valid PubSubPushRequest request) {
        PubSubPushRequest.Message message = request.message();
        EtlOutcome outcome = pipeline.process(messageId(message), message.data());

        return switch (outcome.status()) {
            case SUCCEEDED, DUPLICATE -> ResponseEntity.noContent().build();
            case REJECTED -> ResponseEntity.ok(PushResponse.from(outcome));
            case FAILED_RETRYABLE -> ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(PushResponse.from(outcome));
        };
    }

    static String messageId(PubSubPushRequest.Message message) {
        if (message.messageId() != null && !message.messageId().isBlank()) {
            return "pubsub:" + message.messageId();
        }
        String data = message.data() == null ? "" : message.data();
        return "pubsub-md5:" + DigestUtils.md5DigestAsHex(data.getBytes(StandardCharsets.UTF_8));
    }
}

package com.eyelevel.demandletter.controller;

import com.eyelevel.demandletter.dto.chat.ChatHistoryItem;
import com.eyelevel.demandletter.dto.chat.ChatRequest;
import com.eyelevel.demandletter.dto.chat.ChatResponse;
import com.eyelevel.demandletter.dto.common.ErrorResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;

import java.util.List;

@Tag(name = "Chat", description = "Relay messages to the chat assistant and review past exchanges.")
public interface ChatApi {

    @Operation(summary = "Send Chat Message",
            description = "Forwards the message to the chat webhook and waits for its reply, up to the configured timeout.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "The assistant's reply.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ChatResponse.class))),
            @ApiResponse(responseCode = "400", description = "Bad Request - The message is empty.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class))),
            @ApiResponse(responseCode = "502", description = "Bad Gateway - The chat webhook failed.",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = ErrorResponse.class),
                            examples = @ExampleObject(name = "Failure", value = """
                                    {
                                        "error": "Chat service unavailable: Webhook responded with HTTP 500",
                                        "response": "Sorry, I couldn't process your message at the moment."
                                    }
                                    """))),
            @ApiResponse(responseCode = "504", description = "Gateway Timeout - The chat webhook did not answer in time.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class)))
    })
    ResponseEntity<ChatResponse> sendMessage(ChatRequest request);

    @Operation(summary = "Chat History", description = "All recorded exchanges in the order they were sent.")
    ResponseEntity<List<ChatHistoryItem>> chatHistory();
}

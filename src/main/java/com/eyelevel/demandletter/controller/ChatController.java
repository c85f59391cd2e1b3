package com.eyelevel.demandletter.controller;

import com.eyelevel.demandletter.dto.chat.ChatHistoryItem;
import com.eyelevel.demandletter.dto.chat.ChatRequest;
import com.eyelevel.demandletter.dto.chat.ChatResponse;
import com.eyelevel.demandletter.service.chat.ChatExchangeService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Slf4j
@RestController
@RequiredArgsConstructor
public class ChatController implements ChatApi {

    private final ChatExchangeService chatExchangeService;

    @Override
    @PostMapping(value = "/send_message", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ChatResponse> sendMessage(@Valid @RequestBody final ChatRequest request) {
        return ResponseEntity.ok(new ChatResponse(chatExchangeService.sendMessage(request.message())));
    }

    @Override
    @GetMapping("/chat/history")
    public ResponseEntity<List<ChatHistoryItem>> chatHistory() {
        return ResponseEntity.ok(chatExchangeService.history());
    }
}

package com.eyelevel.demandletter.dto.chat;

public record ChatResponse(String response) {
}

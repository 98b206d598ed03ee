package com.chatlive.realtime.chat.api;

public record ReadReceipt(String roomId, String readerId, int count) {
}

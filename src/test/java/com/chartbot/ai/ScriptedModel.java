package com.chartbot.ai;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.output.Response;

import java.util.ArrayList;
import java.util.List;

final class ScriptedModel implements ChatLanguageModel {
    private final String reply;
    private final RuntimeException failure;
    final List<List<ChatMessage>> calls = new ArrayList<>();

    ScriptedModel(String reply) {
        this.reply = reply;
        this.failure = null;
    }

    ScriptedModel(RuntimeException failure) {
        this.reply = null;
        this.failure = failure;
    }

    @Override
    public Response<AiMessage> generate(List<ChatMessage> messages) {
        calls.add(messages);
        if (failure != null) {
            throw failure;
        }
        return Response.from(AiMessage.aiMessage(reply));
    }
}

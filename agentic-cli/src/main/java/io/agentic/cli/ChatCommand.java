package io.agentic.cli;

import io.agentic.core.model.ChatResponse;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(name = "chat", description = "Send one message and print the reply")
public final class ChatCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(index = "0", arity = "1", description = "Message to send")
    String message;

    @Option(names = {"-c", "--conversation"}, description = "Conversation id to continue")
    String conversationId;

    public ChatCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        String text = message == null ? "" : message.trim();
        if (text.isEmpty()) {
            System.err.println("Message must not be blank");
            return 2;
        }
        try {
            ChatResponse response = context.agent().reply(conversationId, text);
            System.out.println(response.reply());
            System.err.println("conversation: " + response.conversationId());
            return 0;
        } catch (Exception e) {
            System.err.println("Chat command failed: " + e.getMessage());
            return 1;
        }
    }
}

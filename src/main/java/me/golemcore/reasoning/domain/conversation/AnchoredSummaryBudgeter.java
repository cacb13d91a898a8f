package me.golemcore.reasoning.domain.conversation;

import me.golemcore.reasoning.domain.model.Message;

import java.util.ArrayList;
import java.util.List;

/**
 * Keeps the pinned messages and the last N messages verbatim and folds
 * everything in between into one synthetic summary message.
 */
public class AnchoredSummaryBudgeter implements ContextBudgeter {

    private static final int EXCERPT_LENGTH = 200;

    private final TokenEstimator estimator;
    private final int recentCount;

    public AnchoredSummaryBudgeter(TokenEstimator estimator, int recentCount) {
        this.estimator = estimator;
        this.recentCount = Math.max(1, recentCount);
    }

    @Override
    public ConversationView apply(Conversation conversation, int tokenBudget) {
        List<Message> full = conversation.requestMessages();
        int fullTokens = estimator.estimate(full);
        if (fullTokens <= tokenBudget) {
            return ConversationView.ofMessages(full, fullTokens);
        }

        List<String> diagnostics = new ArrayList<>();
        List<Message> history = conversation.historyMessages();
        List<Message> pinned = conversation.pinnedMessages();
        if (history.size() <= recentCount) {
            List<Message> windowed = SlidingWindowBudgeter.fit(pinned, history, tokenBudget, estimator,
                    diagnostics);
            return new ConversationView(windowed, diagnostics, estimator.estimate(windowed));
        }

        int start = history.size() - recentCount;
        // never open the recent window on a tool result whose call would be folded away
        while (start > 0 && history.get(start).isToolMessage()) {
            start--;
        }

        List<Message> anchors = new ArrayList<>(pinned);
        if (start > 0) {
            anchors.add(Message.user(summarize(history.subList(0, start))));
            diagnostics.add("anchored-summary: folded " + start + " message(s) into a summary");
        }
        List<Message> recent = history.subList(start, history.size());

        List<Message> projected = new ArrayList<>(anchors);
        projected.addAll(recent);
        int projectedTokens = estimator.estimate(projected);
        if (projectedTokens <= tokenBudget) {
            return new ConversationView(projected, diagnostics, projectedTokens);
        }

        List<Message> windowed = SlidingWindowBudgeter.fit(anchors, recent, tokenBudget, estimator, diagnostics);
        return new ConversationView(windowed, diagnostics, estimator.estimate(windowed));
    }

    static String summarize(List<Message> folded) {
        int toolCalls = 0;
        int toolResults = 0;
        String lastUserRequest = null;
        for (Message message : folded) {
            if (message.hasToolCalls()) {
                toolCalls += message.getToolCalls().size();
            }
            if (message.isToolMessage()) {
                toolResults++;
            }
            if (message.isUserMessage() && message.getContent() != null) {
                lastUserRequest = message.getContent();
            }
        }

        StringBuilder sb = new StringBuilder("[Context summary: ")
                .append(folded.size()).append(" earlier message(s) omitted (")
                .append(toolCalls).append(" tool call(s), ")
                .append(toolResults).append(" tool result(s)).");
        if (lastUserRequest != null) {
            String excerpt = lastUserRequest.length() > EXCERPT_LENGTH
                    ? lastUserRequest.substring(0, EXCERPT_LENGTH) + "..."
                    : lastUserRequest;
            sb.append(" Last user request in that span: \"").append(excerpt).append("\".");
        }
        return sb.append(']').toString();
    }
}

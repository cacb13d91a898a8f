package me.golemcore.reasoning.domain.conversation;

import me.golemcore.reasoning.domain.model.Message;

import java.util.List;

/**
 * Advisory token cost of messages. Estimates are reconciled with provider
 * reported usage, they never need to be exact.
 */
public interface TokenEstimator {

    int estimate(Message message);

    default int estimate(List<Message> messages) {
        int total = 0;
        for (Message message : messages) {
            total += estimate(message);
        }
        return total;
    }
}

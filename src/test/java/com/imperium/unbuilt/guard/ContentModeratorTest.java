package com.imperium.unbuilt.guard;

import com.imperium.unbuilt.model.entity.Message;
import com.imperium.unbuilt.support.InMemoryConversationStore;
import com.imperium.unbuilt.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ContentModeratorTest {

    private InMemoryConversationStore store;
    private MutableClock clock;
    private ContentModerator moderator;
    private final GuardContext ctx = new GuardContext("u1", "c1", "10.0.0.1", "junit");

    @BeforeEach
    void setUp() {
        store = new InMemoryConversationStore();
        clock = new MutableClock(Instant.parse("2026-03-10T10:00:00Z"));
        moderator = new ContentModerator(new PatternModerationClassifier(), store, clock);
    }

    @Test
    void rejectsHarassment() {
        ModerationResult result = moderator.moderateUserInput("You are an idiot", "u1", ctx);

        assertThat(result.approved()).isFalse();
        assertThat(result.severity()).isEqualTo(Severity.HIGH);
        assertThat(result.categories()).containsExactly("harassment");
    }

    @Test
    void approvesMediumSeverityWithoutReview() {
        ModerationResult result = moderator.moderateUserInput("Should my landing page say buy now?", "u1", ctx);

        assertThat(result.approved()).isTrue();
        assertThat(result.severity()).isEqualTo(Severity.MEDIUM);
        assertThat(result.categories()).containsExactly("spam");
    }

    @Test
    void approvesOrdinaryQuestions() {
        ModerationResult result = moderator.moderateUserInput("How should I price the premium plan?", "u1", ctx);

        assertThat(result.approved()).isTrue();
        assertThat(result.severity()).isEqualTo(Severity.LOW);
        assertThat(result.categories()).isEmpty();
    }

    @Test
    void reportFlagsTheMessage() {
        Message reply = assistantReply();

        ReportResult result = moderator.reportMessage(
                new MessageReportCommand(reply.getId(), "u1", "inaccurate", "Numbers look wrong", null), ctx);

        assertThat(result.success()).isTrue();
        assertThat(result.reportId()).startsWith("rpt_");
        assertThat(store.getMessage(reply.getId()).getFlagged()).isTrue();
        assertThat(store.reports()).singleElement()
                .satisfies(r -> {
                    assertThat(r.getStatus()).isEqualTo("pending");
                    assertThat(r.getConversationId()).isEqualTo(reply.getConversationId());
                });
    }

    @Test
    void reportOnUnknownMessageFails() {
        ReportResult result = moderator.reportMessage(
                new MessageReportCommand("msg_missing", "u1", "spam", "spam", null), ctx);

        assertThat(result.success()).isFalse();
        assertThat(store.reports()).isEmpty();
    }

    @Test
    void reportAbuseIsCountedWithinTheWindow() {
        Message reply = assistantReply();
        for (int i = 0; i < 10; i++) {
            moderator.reportMessage(new MessageReportCommand(reply.getId(), "u1", "other", "again " + i, null), ctx);
        }

        ReportAbuseCheck check = moderator.checkReportAbuse("u1");
        assertThat(check.abusive()).isTrue();
        assertThat(check.reportCount()).isEqualTo(10);
        assertThat(moderator.checkReportAbuse("u2").abusive()).isFalse();

        clock.advance(Duration.ofHours(2));
        assertThat(moderator.checkReportAbuse("u1").abusive()).isFalse();
    }

    private Message assistantReply() {
        String conversationId = store.getOrCreateConversation("a1", "u1").conversation().getId();
        Message m = new Message();
        m.setConversationId(conversationId);
        m.setRole(Message.ROLE_ASSISTANT);
        m.setContent("The market is roughly $2B.");
        m.setStatus(Message.STATUS_DONE);
        return store.appendMessage(m);
    }
}

package com.ryuqq.handover.testkit.notify;

import com.ryuqq.handover.core.exception.NotificationException;
import com.ryuqq.handover.core.spi.Notifier;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * {@link Notifier} fake that records every message.
 *
 * <p>{@link #failWith(NotificationException)} makes every later call throw; failed
 * calls are still recorded as attempts.</p>
 *
 * @author Handover Team
 * @since 1.0.0
 */
public class RecordingNotifier implements Notifier {

    private final List<Notice> notices = new CopyOnWriteArrayList<>();
    private volatile NotificationException failure;

    @Override
    public void notify(String recipient, String subject, String body) {
        notices.add(new Notice(recipient, subject, body));
        NotificationException current = failure;
        if (current != null) {
            throw current;
        }
    }

    public RecordingNotifier failWith(NotificationException failure) {
        this.failure = failure;
        return this;
    }

    public List<Notice> notices() {
        return List.copyOf(notices);
    }

    public List<String> subjects() {
        return notices.stream().map(Notice::subject).collect(Collectors.toList());
    }

    public long count(String subject) {
        return notices.stream().filter(n -> n.subject().equals(subject)).count();
    }

    public void clear() {
        notices.clear();
    }

    /**
     * One recorded message.
     */
    public record Notice(String recipient, String subject, String body) {
    }
}

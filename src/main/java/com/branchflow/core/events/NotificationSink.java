package com.branchflow.core.events;

/**
 * External messaging collaborator that receives promotion events (chat, email, webhook).
 */
public interface NotificationSink {

    /** Short name for logs and health output. */
    String name();

    void deliver(PromotionEvent event);
}

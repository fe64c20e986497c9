package com.taskbot.action;

import java.util.ArrayList;
import java.util.List;

/**
 * Reply for the sender plus any messages for other users, delivered after the action has committed.
 */
public record ActionResult(String reply, List<Notice> notices) {

    public record Notice(String address, String text) {
    }

    public ActionResult {
        notices = notices == null ? List.of() : List.copyOf(notices);
    }

    public static ActionResult reply(String text) {
        return new ActionResult(text, List.of());
    }

    public ActionResult withNotice(String address, String text) {
        if (address == null || address.isBlank()) {
            return this;
        }
        List<Notice> merged = new ArrayList<>(notices);
        merged.add(new Notice(address, text));
        return new ActionResult(reply, merged);
    }
}

package com.actionguard.gateway.api.dto;

import com.actionguard.gateway.plan.Action;

import java.util.List;

public record ActionView(String kind, List<String> args, String raw) {

    public static ActionView from(Action a) {
        return new ActionView(a.name(), a.args(), a.raw());
    }
}

package com.ambient.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Optional overrides for where a session's workspace and message logs live inside the
 * tenant content root.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record SessionPaths(String workspace, String messages, String inbox) {

    public static String defaultWorkspace(String sessionName) {
        return "/sessions/" + sessionName + "/workspace";
    }

    public static String defaultMessages(String sessionName) {
        return "/sessions/" + sessionName + "/messages.json";
    }

    public static String defaultInbox(String sessionName) {
        return "/sessions/" + sessionName + "/inbox.jsonl";
    }

    public static String workspaceOf(SessionPaths paths, String sessionName) {
        return paths != null && paths.workspace() != null && !paths.workspace().isBlank()
                ? paths.workspace() : defaultWorkspace(sessionName);
    }

    public static String messagesOf(SessionPaths paths, String sessionName) {
        return paths != null && paths.messages() != null && !paths.messages().isBlank()
                ? paths.messages() : defaultMessages(sessionName);
    }

    public static String inboxOf(SessionPaths paths, String sessionName) {
        return paths != null && paths.inbox() != null && !paths.inbox().isBlank()
                ? paths.inbox() : defaultInbox(sessionName);
    }
}

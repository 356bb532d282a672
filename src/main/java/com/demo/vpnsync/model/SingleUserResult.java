package com.demo.vpnsync.model;

public final class SingleUserResult {

    public enum Action {
        CREATED("created"),
        UPDATED("updated");

        private final String label;

        Action(String label) {
            this.label = label;
        }

        public String getLabel() {
            return label;
        }
    }

    private final long userId;
    private final String username;
    private final Action action;
    private final String tempPassword;

    public SingleUserResult(long userId, String username, Action action, String tempPassword) {
        this.userId = userId;
        this.username = username;
        this.action = action;
        this.tempPassword = tempPassword;
    }

    public long getUserId() { return userId; }

    public String getUsername() { return username; }

    public Action getAction() { return action; }

    /** Only set when the user was created. */
    public String getTempPassword() { return tempPassword; }
}

package com.growfolio.dataclient.repository;

/*
 * 09/25/2026 - 1:43 PM
 * @author Growfolio Engineering
 */

import com.growfolio.synccore.invalidation.MutationKind;

/**
 * Every successful write a repository can perform.
 */
public enum DataMutation implements MutationKind {

    // Portfolio
    CREATE_PORTFOLIO("portfolio"),
    UPDATE_PORTFOLIO("portfolio"),
    SET_DEFAULT_PORTFOLIO("portfolio"),
    DELETE_PORTFOLIO("portfolio"),
    ADD_HOLDING("portfolio"),
    UPDATE_HOLDING("portfolio"),
    REMOVE_HOLDING("portfolio"),
    ADD_LEDGER_ENTRY("portfolio"),
    UPDATE_LEDGER_ENTRY("portfolio"),
    DELETE_LEDGER_ENTRY("portfolio"),
    DEPOSIT_CASH("portfolio"),
    WITHDRAW_CASH("portfolio"),
    TRANSFER_CASH("portfolio"),

    // Goal
    CREATE_GOAL("goal"),
    UPDATE_GOAL("goal"),
    UPDATE_GOAL_PROGRESS("goal"),
    ARCHIVE_GOAL("goal"),
    UNARCHIVE_GOAL("goal"),
    LINK_GOAL("goal"),
    UNLINK_GOAL("goal"),
    DELETE_GOAL("goal"),

    // DCA
    CREATE_SCHEDULE("dca"),
    UPDATE_SCHEDULE("dca"),
    PAUSE_SCHEDULE("dca"),
    RESUME_SCHEDULE("dca"),
    CANCEL_SCHEDULE("dca"),
    DELETE_SCHEDULE("dca"),

    // Family
    CREATE_FAMILY("family"),
    UPDATE_FAMILY("family"),
    DELETE_FAMILY("family"),
    LEAVE_FAMILY("family"),
    INVITE_MEMBER("family"),
    RESEND_INVITE("family"),
    CANCEL_INVITE("family"),
    ACCEPT_INVITE("family"),
    DECLINE_INVITE("family"),
    UPDATE_MEMBER_ROLE("family"),
    UPDATE_MEMBER_PRIVACY("family"),
    REMOVE_MEMBER("family"),

    // Funding
    INITIATE_DEPOSIT("funding"),
    CONFIRM_DEPOSIT("funding"),
    INITIATE_WITHDRAWAL("funding"),
    CONFIRM_WITHDRAWAL("funding"),
    CANCEL_TRANSFER("funding"),

    // Stocks
    SUBMIT_BUY_ORDER("stocks"),
    ADD_TO_WATCHLIST("stocks"),
    REMOVE_FROM_WATCHLIST("stocks"),

    // User
    UPDATE_PROFILE("user"),
    UPDATE_PREFERENCES("user"),
    DELETE_ACCOUNT("user");

    private final String domain;

    DataMutation(String domain) {
        this.domain = domain;
    }

    @Override
    public String domain() {
        return domain;
    }
}

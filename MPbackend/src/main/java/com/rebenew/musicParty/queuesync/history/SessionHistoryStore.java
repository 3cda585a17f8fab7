package com.rebenew.musicParty.queuesync.history;

public interface SessionHistoryStore {

    void save(SessionHistory history);
}

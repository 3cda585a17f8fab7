package com.rebenew.musicParty.queuesync.model;

/**
 * Miembro del roster de una sesión.
 */
public record Member(String memberId, MemberRole role, long joinedAt) {

    public Member withRole(MemberRole newRole) {
        return new Member(memberId, newRole, joinedAt);
    }
}

package com.finalsign.modules.notification.event;

/**
 * One recipient to be invited. The access token is the recipient's only credential.
 */
public record RecipientInvitation(Integer order, String email, String name, String accessToken) {
}

package com.dbmaster.notification;

import com.dbmaster.model.NotificationChannel;
import com.dbmaster.model.NotificationRequest;

/**
 * Transport for one notification channel. Implementations are discovered as Spring beans; a
 * channel without a sender bean reports "no sender configured".
 */
public interface NotificationSender {

    NotificationChannel channel();

    void send(NotificationRequest request, DeliveryTarget target) throws NotificationDeliveryException;
}

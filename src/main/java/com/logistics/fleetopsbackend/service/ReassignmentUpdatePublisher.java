package com.logistics.fleetopsbackend.service;

import com.logistics.fleetopsbackend.dto.ReassignmentEvent;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

@Service
public class ReassignmentUpdatePublisher {

    public static final String TOPIC = "/topic/reassignments";

    private final SimpMessagingTemplate messagingTemplate;

    @Autowired
    public ReassignmentUpdatePublisher(SimpMessagingTemplate messagingTemplate) {
        this.messagingTemplate = messagingTemplate;
    }

    public void publishReassignment(ReassignmentEvent event) {
        messagingTemplate.convertAndSend(TOPIC, event);
    }
}

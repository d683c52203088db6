package com.abba.pillnow.domain.service;

public interface MailGateway {

    void send(String to, String subject, String text);
}

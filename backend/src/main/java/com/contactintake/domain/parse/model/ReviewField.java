package com.contactintake.domain.parse.model;

public enum ReviewField {
    NAME,
    PHONE_NUMBER,
    ROOM_IDENTIFIER
}

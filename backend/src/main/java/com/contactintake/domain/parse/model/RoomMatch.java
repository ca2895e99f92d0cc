package com.contactintake.domain.parse.model;

/**
 * Room/unit token found in a line.
 *
 * @param identifier the token without any leading '#'
 * @param start      start offset of the consumed text (including a leading '#')
 * @param end        end offset (exclusive)
 * @param keyword    true if found after a label word such as "Room" or "Unit"
 */
public record RoomMatch(
        String identifier,
        int start,
        int end,
        boolean keyword
) {}

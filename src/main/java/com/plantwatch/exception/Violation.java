package com.plantwatch.exception;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * One input problem: where it is ({@code ["body","readings",1,"kind"]}),
 * what is wrong and a machine-readable type.
 */
@Getter
@AllArgsConstructor
public class Violation {
    private final List<Object> loc;
    private final String msg;
    private final String type;
}

package com.commerce.shared.task;

/**
 * Typed body of a {@link Task}. Every component declares its requests as a
 * sealed family of records implementing this interface.
 */
public interface TaskRequest {

    /** Wire tag of the operation, one of the {@link TaskTypes} constants. */
    String type();
}

package com.bgmarchive.types;

/**
 * An enumeration member identified on the wire by an integer code.
 */
public interface CodedEnum {

    int code();

    String label();
}

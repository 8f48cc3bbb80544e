package com.treasurylens.common;

/**
 * A packed on-chain word carried a field outside its domain. Never clamped.
 */
public class MetadataDecodeException extends TreasuryDataException {

    public MetadataDecodeException(String message) {
        super(ErrorKind.DECODE, message);
    }
}

package com.marginledger.relay;

/** Checks that a delegated call was signed with the trader's registered relay key. */
public interface CallSignatureVerifier {

    boolean verify(DelegatedCall call, String signingKey);
}

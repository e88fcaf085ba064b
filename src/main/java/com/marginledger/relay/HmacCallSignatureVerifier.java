package com.marginledger.relay;

import com.marginledger.core.HmacSigner;
import org.springframework.stereotype.Component;

/** HMAC-SHA256 of {@link DelegatedCall#canonicalForm()}, hex encoded. */
@Component
public class HmacCallSignatureVerifier implements CallSignatureVerifier {

    @Override
    public boolean verify(DelegatedCall call, String signingKey) {
        return HmacSigner.verify(call.canonicalForm(), signingKey, call.getSignature());
    }

    public String sign(DelegatedCall call, String signingKey) {
        return HmacSigner.sign(call.canonicalForm(), signingKey);
    }
}

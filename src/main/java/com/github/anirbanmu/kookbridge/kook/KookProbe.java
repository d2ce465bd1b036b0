package com.github.anirbanmu.kookbridge.kook;

import com.github.anirbanmu.kookbridge.kook.json.RestPayloads.SelfUser;

// one-shot token check against /user/me
public final class KookProbe {
    public record ProbeResult(boolean ok, String error, String botId, String botName) {
    }

    private KookProbe() {
    }

    public static ProbeResult probe(KookApi api) {
        KookResult<SelfUser> result = api.fetchSelfIdentity();
        if (result instanceof KookResult.Failure<SelfUser> f) {
            return new ProbeResult(false, f.message(), null, null);
        }
        SelfUser self = ((KookResult.Success<SelfUser>) result).value();
        if (self.id() == null || self.id().isEmpty()) {
            return new ProbeResult(false, "identity response without id", null, null);
        }
        return new ProbeResult(true, null, self.id(), self.username());
    }
}

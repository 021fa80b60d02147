package com.netflix.kubebalance;

import org.junit.Assert;
import org.junit.Test;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.concurrent.atomic.AtomicInteger;

import static com.netflix.kubebalance.PodProvider.guaranteedPod;

public class AdmissionGateTest {

    private final EvictionCandidate candidate = new EvictionCandidate(guaranteedPod("p", "n1", "web"), null, null);

    @Test
    public void testNoChecksAdmits() {
        Assert.assertTrue(new AdmissionGate(Collections.emptyList()).evaluate(candidate, Instant.now()).isAdmitted());
    }

    @Test
    public void testStopsAtFirstRejection() {
        final AtomicInteger laterCalls = new AtomicInteger();
        final AdmissionGate gate = new AdmissionGate(Arrays.asList(
                (c, now) -> AdmissionCheck.Result.admitted(),
                (c, now) -> AdmissionCheck.Result.rejected(AdmissionCheck.Reason.Other, "no"),
                (c, now) -> {
                    laterCalls.incrementAndGet();
                    return AdmissionCheck.Result.admitted();
                }
        ));
        final AdmissionCheck.Result result = gate.evaluate(candidate, Instant.now());
        Assert.assertFalse(result.isAdmitted());
        Assert.assertEquals(AdmissionCheck.Reason.Other, result.getReason());
        Assert.assertEquals("no", result.getMessage());
        Assert.assertEquals(0, laterCalls.get());
    }
}

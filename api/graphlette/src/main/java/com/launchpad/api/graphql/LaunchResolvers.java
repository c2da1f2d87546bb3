package com.launchpad.api.graphql;

import com.launchpad.api.graphql.args.PatchSizeArgs;
import com.launchpad.core.Launch;
import com.launchpad.core.Mission;
import com.launchpad.core.RequestContext;
import org.dataloader.DataLoader;

import java.util.Set;
import java.util.concurrent.CompletableFuture;

public class LaunchResolvers {

    /**
     * Anonymous callers have booked nothing. For everyone else the booked set comes from the
     * request's {@code bookings} loader, so a list of launches costs one store call.
     */
    public CompletableFuture<Boolean> isBooked(Launch launch, RequestContext context, DataLoader<String, Set<String>> bookings) {
        if (!context.isAuthenticated()) {
            return CompletableFuture.completedFuture(false);
        }
        return bookings.load(context.user().id())
                .thenApply(booked -> booked.contains(launch.id()));
    }

    public String missionPatch(Mission mission, PatchSizeArgs args) {
        return mission.missionPatch(args.size());
    }
}

package com.launchpad.api.graphql;

import com.launchpad.api.graphql.args.LaunchArgs;
import com.launchpad.core.Launch;
import com.launchpad.core.RequestContext;
import com.launchpad.core.User;

import java.util.List;
import java.util.concurrent.CompletableFuture;

public class QueryResolvers {

    public CompletableFuture<List<Launch>> launches(RequestContext context) {
        return context.catalog().listAll();
    }

    /**
     * An unknown id resolves to null rather than an error.
     */
    public CompletableFuture<Launch> launch(LaunchArgs args, RequestContext context) {
        return context.catalog().getById(args.id());
    }

    public User me(RequestContext context) {
        return context.user();
    }
}

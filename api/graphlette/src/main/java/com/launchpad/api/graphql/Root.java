package com.launchpad.api.graphql;

import com.launchpad.api.graphql.args.LaunchArgs;
import com.launchpad.api.graphql.args.LoginArgs;
import com.launchpad.api.graphql.args.PatchSizeArgs;
import com.launchpad.api.graphql.args.TripArgs;
import com.launchpad.core.RequestContext;
import graphql.schema.DataFetcher;
import graphql.schema.DataFetchingEnvironment;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The field handlers, keyed by type name and then field name. Fields missing here fall back to
 * graphql-java's property fetching on the parent record.
 */
public class Root {

    public static Map<String, Map<String, DataFetcher<?>>> create() {
        return create(new QueryResolvers(), new MutationResolvers(), new UserResolvers(), new LaunchResolvers());
    }

    public static Map<String, Map<String, DataFetcher<?>>> create(
            QueryResolvers queries,
            MutationResolvers mutations,
            UserResolvers users,
            LaunchResolvers launches
    ) {
        Map<String, Map<String, DataFetcher<?>>> base = new LinkedHashMap<>();

        base.put("Query", Map.of(
            "launches", env -> queries.launches(context(env)),
            "launch", env -> queries.launch(LaunchArgs.from(env.getArguments()), context(env)),
            "me", env -> queries.me(context(env))
        ));

        base.put("Mutation", Map.of(
            "bookTrip", env -> mutations.bookTrip(TripArgs.from(env.getArguments()), context(env), env.getDataLoader(DataLoaderFactory.BOOKINGS)),
            "cancelTrip", env -> mutations.cancelTrip(TripArgs.from(env.getArguments()), context(env), env.getDataLoader(DataLoaderFactory.BOOKINGS)),
            "login", env -> mutations.login(LoginArgs.from(env.getArguments()), context(env))
        ));

        base.put("User", Map.of(
            "trips", env -> users.trips(env.getSource(), context(env))
        ));

        base.put("Launch", Map.of(
            "isBooked", env -> launches.isBooked(env.getSource(), context(env), env.getDataLoader(DataLoaderFactory.BOOKINGS))
        ));

        base.put("Mission", Map.of(
            "missionPatch", env -> launches.missionPatch(env.getSource(), PatchSizeArgs.from(env.getArguments()))
        ));

        return base;
    }

    static RequestContext context(DataFetchingEnvironment env) {
        RequestContext context = env.getGraphQlContext().get(RequestContext.class);
        if (context == null) {
            throw new IllegalStateException("No request context attached to this execution");
        }
        return context;
    }
}

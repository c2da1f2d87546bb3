package com.launchpad.repos.certification;

import com.launchpad.core.Launch;
import com.launchpad.core.Mission;
import com.launchpad.core.Rocket;

import java.util.List;

public final class CatalogFixtures {
    private CatalogFixtures() {
    }

    public static Launch launch(String id, String missionName, int year) {
        return new Launch(
                id,
                "KSC LC 39A",
                new Mission(
                        missionName,
                        "https://images2.imgbox.com/" + id + "_small.png",
                        "https://images2.imgbox.com/" + id + "_large.png"
                ),
                new Rocket("falcon9", "Falcon 9", "FT"),
                year
        );
    }

    public static List<Launch> launches() {
        return List.of(
                launch("1", "FalconSat", 2006),
                launch("2", "DemoSat", 2007),
                launch("3", "Trailblazer", 2008),
                launch("4", "RatSat", 2008)
        );
    }
}

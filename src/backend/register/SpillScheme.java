package backend.register;

import utils.Config;

public interface SpillScheme {
    enum SpillSchemeChoice {
        Single, Rate,
    }

    int spillsThisRound(int spilledSoFar);

    static SpillScheme of(SpillSchemeChoice choice, int spillingRate) {
        if (choice == SpillSchemeChoice.Rate && spillingRate > 0) {
            return new RateSpillScheme(spillingRate);
        }
        return new SingleSpillScheme();
    }

    static SpillScheme fromConfig() {
        return of(Config.spillChoice, Config.spillingRate);
    }

    class SingleSpillScheme implements SpillScheme {
        @Override
        public int spillsThisRound(int spilledSoFar) {
            return 1;
        }
    }

    class RateSpillScheme implements SpillScheme {
        private final int rate;

        public RateSpillScheme(int rate) {
            if (rate <= 0) {
                throw new IllegalArgumentException("spilling rate must be positive");
            }
            this.rate = rate;
        }

        @Override
        public int spillsThisRound(int spilledSoFar) {
            return Math.max(1, spilledSoFar / rate);
        }
    }
}

package io.github.manjago.arbor.core;

public class InvalidTournamentSizeException extends GpException {

    public InvalidTournamentSizeException(int tournamentSize) {
        super("Tournament size must be at least 1, got " + tournamentSize);
    }

    public InvalidTournamentSizeException(int tournamentSize, int populationSize) {
        super(String.format("Tournament size %d is not in [1, %d]", tournamentSize, populationSize));
    }
}

package com.chicu.simorch.simulator;

import java.time.Duration;
import java.util.List;

public interface SimulatorProcessRunner {

    /**
     * Блокирующий запуск симулятора. Вызывать только с worker-потока.
     *
     * @param args    аргументы подкоманды (без префикса executable)
     * @param timeout после истечения процесс убивается и бросается SimulationTimeoutException
     */
    ProcessOutcome run(List<String> args, Duration timeout);
}

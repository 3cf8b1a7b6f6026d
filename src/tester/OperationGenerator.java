package tester;

import tester.models.RType;
import tester.models.Request;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

public class OperationGenerator {
    private static final RType[] TYPES = RType.values();

    private final double addProbability;
    private final int valueSpace;
    private final Random random;

    public OperationGenerator(double addProbability, int valueSpace, long seed) {
        if (addProbability < 0 || addProbability > 1) {
            throw new IllegalArgumentException("addProbability must lie in [0, 1]: " + addProbability);
        }
        this.addProbability = addProbability;
        this.valueSpace = valueSpace;
        this.random = new Random(seed);
    }

    public List<Request> setupRequests(int requests) {
        final List<Request> result = new ArrayList<>(requests);
        for (int i = 0; i < requests; i++) {
            result.add(generateRequest(i));
        }
        return result;
    }

    private Request generateRequest(int id) {
        final RType type;
        if (random.nextDouble() < addProbability) {
            type = random.nextBoolean() ? RType.ADD_LAST : (random.nextBoolean() ? RType.ADD_FIRST : RType.ADD_AT);
        } else {
            type = TYPES[random.nextInt(TYPES.length)];
        }
        // small value space so sorting sees plenty of ties
        return new Request(type, random.nextInt(Integer.MAX_VALUE), random.nextInt(valueSpace), id);
    }

    public double getAddProbability() {
        return addProbability;
    }
}

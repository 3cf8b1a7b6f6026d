package tester.models;

public class Request {
    final RType type;
    final int index;
    final int value;
    final int id;

    public Request(RType type, int index, int value, int id) {
        this.type = type;
        this.index = index;
        this.value = value;
        this.id = id;
    }

    @Override
    public String toString() {
        return "{" +
                "type=" + type +
                ", index=" + index +
                ", value=" + value +
                ", id=" + id +
                '}';
    }

    public RType getType() {
        return type;
    }

    /**
     * Raw position seed, reduced modulo the list size when the request is applied.
     */
    public int getIndex() {
        return index;
    }

    public int getValue() {
        return value;
    }

    public int getId() {
        return id;
    }
}

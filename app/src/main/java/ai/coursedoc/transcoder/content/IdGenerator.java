package ai.coursedoc.transcoder.content;

@FunctionalInterface
public interface IdGenerator {
    String nextId();
}

package prodcons;

/**
 * Raised by {@link BoundedBuffer#take()} when every producer has finished and nothing is left to take.
 */
public class BufferDrainedException extends RuntimeException {

    public BufferDrainedException(String message) {
        super(message);
    }
}

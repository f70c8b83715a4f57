package fr.lapetina.synapse.gateway.feed;

import com.lmax.disruptor.EventFactory;

/**
 * Pre-allocates the feed's ring buffer slots.
 */
public final class FeedCommandFactory implements EventFactory<FeedCommand> {

    @Override
    public FeedCommand newInstance() {
        return new FeedCommand();
    }
}

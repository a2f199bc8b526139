package com.vigil.service.core.cache;

import com.vigil.service.core.model.Checkable;
import com.vigil.service.core.registry.EntityRegistry;
import java.util.Set;
import org.springframework.stereotype.Component;

@Component
public class DowntimeCache extends RecordOwnerCache {

    public DowntimeCache(EntityRegistry registry) {
        super(registry);
    }

    @Override
    protected Set<String> recordIds(Checkable checkable) {
        return checkable.getDowntimes().keySet();
    }
}

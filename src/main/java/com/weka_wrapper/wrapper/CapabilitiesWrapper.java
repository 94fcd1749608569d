package com.weka_wrapper.wrapper;

import com.weka_wrapper.runtime.JavaObjectSource;
import com.weka_wrapper.runtime.WekaRuntime;
import weka.core.Capabilities;
import weka.core.Capabilities.Capability;
import weka.core.Instances;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

public class CapabilitiesWrapper extends JavaObjectWrapper<Capabilities> {

    public CapabilitiesWrapper(WekaRuntime runtime, Capabilities capabilities) throws Exception {
        super(runtime, JavaObjectSource.fromExisting(capabilities), Capabilities.class);
    }

    /**
     * Whether the data satisfies these capabilities.
     */
    public boolean test(Instances data) {
        return getJavaObject().test(data);
    }

    /**
     * @param capabilityName a {@link Capability} constant name, e.g. {@code NUMERIC_ATTRIBUTES}
     */
    public boolean handles(String capabilityName) {
        return getJavaObject().handles(Capability.valueOf(capabilityName));
    }

    public List<String> listCapabilities() {
        List<String> names = new ArrayList<>();
        Iterator<Capability> iterator = getJavaObject().capabilities();
        while (iterator.hasNext()) {
            names.add(iterator.next().name());
        }
        return names;
    }
}

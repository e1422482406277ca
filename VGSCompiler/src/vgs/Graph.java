package vgs;

import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.auto.value.extension.memoized.Memoized;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

@AutoValue
public abstract class Graph {

  public enum PortKind {
    EXEC,
    DATA
  }

  @AutoValue
  public abstract static class Port {
    public abstract String id();

    public abstract String label();

    public abstract PortKind kind();

    public abstract Optional<String> dataType();

    public final boolean isExec() {
      return kind() == PortKind.EXEC;
    }

    public static Port exec(String id, String label) {
      return new AutoValue_Graph_Port(id, label, PortKind.EXEC, Optional.empty());
    }

    public static Port data(String id, String label) {
      return new AutoValue_Graph_Port(id, label, PortKind.DATA, Optional.empty());
    }

    public static Port data(String id, String label, String dataType) {
      return new AutoValue_Graph_Port(id, label, PortKind.DATA, Optional.of(dataType));
    }

    public static Port create(String id, String label, PortKind kind, Optional<String> dataType) {
      return new AutoValue_Graph_Port(id, label, kind, dataType);
    }
  }

  // (nodeId, portId)
  @AutoValue
  public abstract static class Endpoint {
    public abstract String nodeId();

    public abstract String portId();

    public static Endpoint of(String nodeId, String portId) {
      return new AutoValue_Graph_Endpoint(nodeId, portId);
    }

    @Override
    public final String toString() {
      return nodeId() + ":" + portId();
    }
  }

  @AutoValue
  public abstract static class Connection {
    public abstract String id();

    public abstract Endpoint from();

    public abstract Endpoint to();

    public static Connection create(String id, Endpoint from, Endpoint to) {
      return new AutoValue_Graph_Connection(id, from, to);
    }
  }

  @AutoValue
  public abstract static class Node {
    public static final String EVENTS_CATEGORY = "events";

    public abstract String id();

    public abstract String type();

    public abstract String category();

    public abstract String label();

    public abstract ImmutableMap<String, Literal> data();

    public abstract ImmutableList<Port> inputs();

    public abstract ImmutableList<Port> outputs();

    public final Optional<Literal> data(String key) {
      return Optional.ofNullable(data().get(key));
    }

    public final Optional<Port> input(String portId) {
      return inputs().stream().filter(p -> p.id().equals(portId)).findFirst();
    }

    public final Optional<Port> output(String portId) {
      return outputs().stream().filter(p -> p.id().equals(portId)).findFirst();
    }

    public final Optional<Port> firstExecOutput() {
      return outputs().stream().filter(Port::isExec).findFirst();
    }

    public final ImmutableList<Port> execOutputs() {
      return outputs().stream().filter(Port::isExec).collect(ImmutableList.toImmutableList());
    }

    public final boolean isEvent() {
      return category().equals(EVENTS_CATEGORY);
    }

    public static Builder builder(String id, String type) {
      return new AutoValue_Graph_Node.Builder()
          .setId(id)
          .setType(type)
          .setCategory("")
          .setLabel(type);
    }

    @AutoValue.Builder
    public abstract static class Builder {
      private int nextInput = 0;
      private int nextOutput = 0;

      abstract Builder setId(String id);

      abstract Builder setType(String type);

      public abstract Builder setCategory(String category);

      public abstract Builder setLabel(String label);

      abstract ImmutableMap.Builder<String, Literal> dataBuilder();

      abstract ImmutableList.Builder<Port> inputsBuilder();

      abstract ImmutableList.Builder<Port> outputsBuilder();

      public final Builder putData(String key, Literal value) {
        dataBuilder().put(key, value);
        return this;
      }

      public final Builder putData(String key, String value) {
        return putData(key, Literal.of(value));
      }

      public final Builder putData(String key, long value) {
        return putData(key, Literal.of(value));
      }

      public final Builder putData(String key, boolean value) {
        return putData(key, Literal.of(value));
      }

      public final Builder addInput(Port port) {
        nextInput++;
        inputsBuilder().add(port);
        return this;
      }

      public final Builder addOutput(Port port) {
        nextOutput++;
        outputsBuilder().add(port);
        return this;
      }

      // The editor numbers ports by position: input_0, input_1, ...
      public final Builder addExecInput(String label) {
        return addInput(Port.exec("input_" + nextInput, label));
      }

      public final Builder addDataInput(String label) {
        return addInput(Port.data("input_" + nextInput, label));
      }

      public final Builder addDataInput(String label, String dataType) {
        return addInput(Port.data("input_" + nextInput, label, dataType));
      }

      public final Builder addExecOutput(String label) {
        return addOutput(Port.exec("output_" + nextOutput, label));
      }

      public final Builder addDataOutput(String label) {
        return addOutput(Port.data("output_" + nextOutput, label));
      }

      public final Builder addDataOutput(String label, String dataType) {
        return addOutput(Port.data("output_" + nextOutput, label, dataType));
      }

      public abstract Node build();
    }
  }

  public abstract ImmutableList<Node> nodes();

  public abstract ImmutableList<Connection> connections();

  public final boolean isEmpty() {
    return nodes().isEmpty();
  }

  @Memoized
  public GraphIndex index() {
    return GraphIndex.of(this);
  }

  public static Graph empty() {
    return builder().build();
  }

  public static Builder builder() {
    return new AutoValue_Graph.Builder();
  }

  @AutoValue.Builder
  public abstract static class Builder {
    private int nextConnection = 0;

    abstract ImmutableList.Builder<Node> nodesBuilder();

    abstract ImmutableList.Builder<Connection> connectionsBuilder();

    public final Builder addNode(Node node) {
      nodesBuilder().add(node);
      return this;
    }

    public final Builder addConnection(Connection connection) {
      nextConnection++;
      connectionsBuilder().add(connection);
      return this;
    }

    public final Builder connect(String fromNode, String fromPort, String toNode, String toPort) {
      return addConnection(
          Connection.create(
              "conn_" + nextConnection,
              Endpoint.of(fromNode, fromPort),
              Endpoint.of(toNode, toPort)));
    }

    public abstract Graph build();
  }
}
